package armscript;

import java.util.Objects;

/** A four-field IR instruction. Its address is its position in the emitted list. */
public record Quadruple(Opcode operator, String operand1, String operand2, String result) {

    // filler for an unused field
    public static final String NONE = "—";

    public Quadruple {
        Objects.requireNonNull(operator);
        operand1 = operand1 == null ? NONE : operand1;
        operand2 = operand2 == null ? NONE : operand2;
        result = result == null ? NONE : result;
    }

    @Override
    public String toString() {
        return "(" + operator + ", " + operand1 + ", " + operand2 + ", " + result + ")";
    }
}
