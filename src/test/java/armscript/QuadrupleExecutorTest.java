package armscript;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

class QuadrupleExecutorTest {

    private final RobotAnalyzer analyzer = new RobotAnalyzer(AnalyzerConfig.defaults());

    private SimulatedRobotDriver runScript(String src) {
        AnalysisResult r = analyzer.analyze(src);
        assertTrue(r.success(), () -> r.errors().toString());
        SimulatedRobotDriver driver = new SimulatedRobotDriver();
        QuadrupleExecutor.of(r, driver).run();
        return driver;
    }

    @Test
    void straightLineProgram() {
        SimulatedRobotDriver d = runScript("Robot R1 R1.velocidad = 2 R1.base = 90 R1.garra.negativo = 30");

        assertEquals(List.of("R1"), d.robots());
        assertEquals(List.of(
                new SimulatedRobotDriver.Motion("R1", "base", 90, 2.0),
                new SimulatedRobotDriver.Motion("R1", "garra", -30, 2.0)),
            d.motions());
        assertEquals(4.0, d.simulatedSeconds());
    }

    @Test
    void loopBodyRunsNTimes() {
        SimulatedRobotDriver d = runScript(
            "Robot R1 R1.repetir = 3 { R1.base = 10 R1.base.negativo = 10 } R1.codo = 5");

        List<SimulatedRobotDriver.Motion> m = d.motions();
        assertEquals(7, m.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(10, m.get(2 * i).value());
            assertEquals(-10, m.get(2 * i + 1).value());
        }
        assertEquals("codo", m.get(6).component());
    }

    @Test
    void speedSetInsideLoopCarriesOver() {
        SimulatedRobotDriver d = runScript("Robot R1 R1.repetir = 2 { R1.velocidad = 1 R1.base = 1 } R1.codo = 1");
        assertEquals(1.0, d.motions().get(2).seconds());
    }

    @Test
    void loopWithoutEndIsRejected() {
        List<Quadruple> code = List.of(
            new Quadruple(Opcode.CREATE, "Robot", null, "R1"),
            new Quadruple(Opcode.BEGIN_LOOP, "2", null, "loop0"),
            new Quadruple(Opcode.MOVE, "R1", "1", "base"));

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> new QuadrupleExecutor(code, new SimulatedRobotDriver()).run());
        assertEquals(1, e.getAddress());
    }

    @Test
    void strayEndLoopIsRejected() {
        List<Quadruple> code = List.of(new Quadruple(Opcode.END_LOOP, "loop0", "2", null));
        assertThrows(ExecutionException.class, () -> new QuadrupleExecutor(code, new SimulatedRobotDriver()).run());
    }

    @Test
    void moveBeforeCreateIsRejected() {
        List<Quadruple> code = List.of(new Quadruple(Opcode.MOVE, "R1", "1", "base"));
        assertThrows(ExecutionException.class, () -> new QuadrupleExecutor(code, new SimulatedRobotDriver()).run());
    }

    @Test
    void moveNeedsASpeedFirst() {
        List<Quadruple> code = List.of(
            new Quadruple(Opcode.CREATE, "Robot", null, "R1"),
            new Quadruple(Opcode.MOVE, "R1", "1", "base"));

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> new QuadrupleExecutor(code, new SimulatedRobotDriver()).run());
        assertEquals(1, e.getAddress());
    }

    @Test
    void configuredDefaultDelayReachesTheDriver() {
        RobotAnalyzer slow = new RobotAnalyzer(new AnalyzerConfig(GripperMode.ROTATION, 9.0));
        SimulatedRobotDriver d = new SimulatedRobotDriver();
        QuadrupleExecutor.of(slow.analyze("Robot R1 R1.base = 1"), d).run();

        assertEquals(9.0, d.motions().get(0).seconds());
    }

    @Test
    void failedAnalysisCannotRun() {
        AnalysisResult r = analyzer.analyze("Robot R1 R1.base = 999");
        assertThrows(IllegalArgumentException.class, () -> QuadrupleExecutor.of(r, new SimulatedRobotDriver()));
    }
}
