package armscript;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a quadruple list in order against a {@link RobotDriver}. A BEGIN_LOOP runs the
 * slice up to the END_LOOP carrying the same loop id N times, then resumes after it.
 */
public class QuadrupleExecutor {
    private static final Logger log = LoggerFactory.getLogger(QuadrupleExecutor.class);

    private final List<Quadruple> code;
    private final RobotDriver driver;
    private final Set<String> robots = new HashSet<>();
    private final Map<String, Double> delays = new HashMap<>(); // active delay per robot, set only by SET_SPEED
    private int steps = 0;

    public QuadrupleExecutor(List<Quadruple> code, RobotDriver driver) {
        this.code = List.copyOf(code);
        this.driver = Objects.requireNonNull(driver);
    }

    // convenience for results straight out of the analyzer
    public static QuadrupleExecutor of(AnalysisResult result, RobotDriver driver) {
        if (!result.success()) {
            throw new IllegalArgumentException("cannot execute a failed analysis");
        }
        return new QuadrupleExecutor(result.quadruples(), driver);
    }

    /** Runs the whole program and returns the number of quadruples executed. */
    public int run() {
        steps = 0;
        robots.clear();
        delays.clear();
        execute(0, code.size());
        log.info("executed {} quadruples", steps);
        return steps;
    }

    // executes [from, to)
    private void execute(int from, int to) {
        int pc = from;
        while (pc < to) {
            Quadruple q = code.get(pc);
            steps++;
            switch (q.operator()) {
                case CREATE -> {
                    robots.add(key(q.result()));
                    driver.create(q.result());
                }
                case SET_SPEED -> {
                    double seconds = parseDelay(q.operand2(), pc);
                    requireRobot(q.operand1(), pc);
                    delays.put(key(q.operand1()), seconds);
                    driver.setDelay(q.operand1(), seconds);
                }
                case MOVE, MOVE_NEG -> {
                    requireRobot(q.operand1(), pc);
                    int value = parseInt(q.operand2(), pc);
                    Double seconds = delays.get(key(q.operand1()));
                    if (seconds == null) {
                        throw new ExecutionException("robot " + q.operand1() + " moved before any SET_SPEED", pc);
                    }
                    driver.move(q.operand1(), q.result(), value, seconds);
                }
                case BEGIN_LOOP -> {
                    int times = parseInt(q.operand1(), pc);
                    int end = findEndLoop(q.result(), pc);
                    for (int n = 0; n < times; n++) {
                        log.debug("{} iteration {}/{}", q.result(), n + 1, times);
                        execute(pc + 1, end);
                    }
                    pc = end; // END_LOOP itself is counted below
                    steps++;
                }
                case END_LOOP -> throw new ExecutionException("END_LOOP " + q.operand1() + " without BEGIN_LOOP", pc);
            }
            pc++;
        }
    }

    private int findEndLoop(String loopId, int begin) {
        for (int i = begin + 1; i < code.size(); i++) {
            Quadruple q = code.get(i);
            if (q.operator() == Opcode.END_LOOP && q.operand1().equals(loopId)) return i;
        }
        throw new ExecutionException("no END_LOOP for " + loopId, begin);
    }

    private void requireRobot(String robot, int pc) {
        if (!robots.contains(key(robot))) {
            throw new ExecutionException("robot " + robot + " used before CREATE", pc);
        }
    }

    private static int parseInt(String s, int pc) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new ExecutionException("expected an integer operand, got '" + s + "'", pc);
        }
    }

    private static double parseDelay(String s, int pc) {
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new ExecutionException("expected a delay in seconds, got '" + s + "'", pc);
        }
    }

    private static String key(String robot) {
        return robot.toLowerCase(Locale.ROOT);
    }
}
