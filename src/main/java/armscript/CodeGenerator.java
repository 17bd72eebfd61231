package armscript;

import java.util.List;

/**
 * Turns validated statements into quadruples and applies their side effects on the
 * symbol table and the velocity registry.
 */
public class CodeGenerator {
    static final String ROBOT_CLASS = "Robot";
    static final String LOOP_PREFIX = "loop";

    private final Emitter em;
    private final SymbolTable table;
    private final VelocityRegistry velocities;

    CodeGenerator(SymbolTable table, VelocityRegistry velocities, Emitter em) {
        this.table = table;
        this.velocities = velocities;
        this.em = em;
    }

    void genRobot(String robotId) {
        table.declare(Symbol.declaration(robotId));
        velocities.register(robotId);
        em.emit(Opcode.CREATE, ROBOT_CLASS, Quadruple.NONE, robotId);
    }

    void genAssignment(SemanticAnalyzer.Assignment a) {
        String robot = a.robotId();
        Command cmd = a.command();

        if (cmd.isMovement()) {
            // every movement carries the delay in force so the executor never has to look back
            em.emit(Opcode.SET_SPEED, robot, formatDelay(velocities.delayOf(robot)), cmd.keyword());
            Opcode op = a.negative() ? Opcode.MOVE_NEG : Opcode.MOVE;
            em.emit(op, robot, String.valueOf(a.value()), cmd.keyword());
        } else {
            double seconds = a.value();
            velocities.set(robot, seconds);
            em.emit(Opcode.SET_SPEED, robot, formatDelay(seconds), cmd.keyword());
        }
        table.upsert(Symbol.assignment(robot, cmd.keyword(), a.value()));
    }

    // body goes out once, the executor owns the repetition
    void genRepeat(SemanticAnalyzer.RepeatHeader h, List<SemanticAnalyzer.Assignment> body) {
        String loopId = em.newLabel(LOOP_PREFIX);
        String count = String.valueOf(h.count());

        em.emit(Opcode.BEGIN_LOOP, count, Quadruple.NONE, loopId);
        for (SemanticAnalyzer.Assignment a : body) {
            genAssignment(a);
        }
        em.emit(Opcode.END_LOOP, loopId, count, Quadruple.NONE);

        table.upsert(Symbol.assignment(h.robotId(), Command.REPETIR.keyword(), h.count()));
    }

    static String formatDelay(double seconds) {
        return String.valueOf(seconds);
    }
}
