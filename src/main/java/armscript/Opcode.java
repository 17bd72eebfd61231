package armscript;

// quadruple operators understood by the executor
public enum Opcode {
    CREATE,
    SET_SPEED,
    MOVE, MOVE_NEG,
    BEGIN_LOOP, END_LOOP
}
