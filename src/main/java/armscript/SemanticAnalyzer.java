package armscript;

import java.util.Locale;

/**
 * Context checks for each statement shape. Every check either returns a validated
 * statement or reports exactly one error and returns null.
 */
public final class SemanticAnalyzer {

    static final String NEGATIVE_SUFFIX = "negativo";

    // a fully checked ID.command[.negativo] = value
    record Assignment(Token at, String robotId, Command command, boolean negative, int magnitude) {
        // 0 stays 0, there is no negative zero for an int
        int value() {
            return negative ? -magnitude : magnitude;
        }
    }

    // a checked ID.repetir = N { header
    record RepeatHeader(Token at, String robotId, int count) {}

    private final SymbolTable table;
    private final ErrorReporter er;
    private final GripperMode gripperMode;

    SemanticAnalyzer(SymbolTable table, ErrorReporter er, GripperMode gripperMode) {
        this.table = table;
        this.er = er;
        this.gripperMode = gripperMode;
    }

    /** Checks {@code Robot <ID>}; returns the identifier or null. */
    String checkRobotDeclaration(Token keyword, Token id) {
        if (id == null) {
            er.syntax("missing identifier after '" + keyword.lexeme + "'", keyword);
            return null;
        }
        if (!Lexer.isIdentifier(id.lexeme)) {
            er.syntax("invalid identifier: '" + id.lexeme + "'", id);
            return null;
        }
        if (table.isDeclared(id.lexeme)) {
            er.semantic("robot already declared: '" + id.lexeme + "'", id);
            return null;
        }
        return id.lexeme;
    }

    /**
     * Checks {@code ID.command[.negativo] = value}. {@code blockRobot} is the robot of the
     * enclosing repeat block, or null at top level.
     */
    Assignment checkAssignment(Token target, Token op, Token value, String blockRobot) {
        String[] parts = target.lexeme.split("\\.", -1);
        boolean negative;
        if (parts.length == 2) {
            negative = false;
        } else if (parts.length == 3 && parts[2].equalsIgnoreCase(NEGATIVE_SUFFIX)) {
            negative = true;
        } else {
            er.syntax("expected ID.command or ID.command.negativo: '" + target.lexeme + "'", target);
            return null;
        }
        String robot = parts[0];
        String keyword = parts[1];

        if (!op.lexeme.equals("=")) {
            er.syntax("expected '=' after " + target.lexeme + ": '" + op.lexeme + "'", op);
            return null;
        }

        if (blockRobot != null && !robot.equalsIgnoreCase(blockRobot)) {
            er.semantic("robot '" + robot + "' referenced inside repeat block of '" + blockRobot + "'", target);
            return null;
        }

        Symbol declared = table.resolveRobot(robot);
        if (declared == null) {
            er.semantic("robot not declared: '" + robot + "'", target);
            return null;
        }

        Command command = Command.fromKeyword(keyword).orElse(null);
        if (command == null) {
            er.semantic("unknown command: '" + keyword + "'", target);
            return null;
        }
        if (command == Command.REPETIR) {
            if (blockRobot != null) {
                er.semantic("nested repeat blocks are not allowed: '" + target.lexeme + "'", target);
            } else {
                er.semantic("'" + target.lexeme + "' must open a block: ID.repetir = N { ... }", target);
            }
            return null;
        }
        if (negative && !command.negatable()) {
            er.semantic("'" + NEGATIVE_SUFFIX + "' is not allowed for " + command.keyword(), target);
            return null;
        }

        if (!Lexer.isUnsignedInteger(value.lexeme)) {
            er.semantic("invalid numeric value: '" + value.lexeme + "'", value);
            return null;
        }
        Integer magnitude = parseBounded(value.lexeme);
        if (magnitude == null || !command.inRange(magnitude, gripperMode)) {
            String name = command.keyword() + (negative ? "." + NEGATIVE_SUFFIX : "");
            er.semantic("value out of range for " + name + ": " + value.lexeme
                    + " (range: " + command.min(gripperMode) + "-" + command.max(gripperMode) + ")", value);
            return null;
        }
        return new Assignment(target, declared.robotId(), command, negative, magnitude);
    }

    /** Checks the four header tokens of a repeat block, the opening brace included. */
    RepeatHeader checkRepeatHeader(Token target, Token op, Token count, Token brace) {
        String[] parts = target.lexeme.split("\\.", -1);
        if (parts.length != 2 || !parts[1].toLowerCase(Locale.ROOT).equals(Command.REPETIR.keyword())) {
            er.syntax("expected ID.repetir: '" + target.lexeme + "'", target);
            return null;
        }
        if (!op.lexeme.equals("=")) {
            er.syntax("expected '=' after " + target.lexeme + ": '" + op.lexeme + "'", op);
            return null;
        }
        if (!brace.lexeme.equals("{")) {
            er.syntax("expected '{' to open the repeat block: '" + brace.lexeme + "'", brace);
            return null;
        }
        Symbol declared = table.resolveRobot(parts[0]);
        if (declared == null) {
            er.semantic("robot not declared: '" + parts[0] + "'", target);
            return null;
        }
        if (!Lexer.isUnsignedInteger(count.lexeme)) {
            er.semantic("invalid repetition count: '" + count.lexeme + "'", count);
            return null;
        }
        Integer n = parseBounded(count.lexeme);
        Command rep = Command.REPETIR;
        if (n == null || !rep.inRange(n, gripperMode)) {
            er.semantic("repetitions out of range: " + count.lexeme
                    + " (range: " + rep.min(gripperMode) + "-" + rep.max(gripperMode) + ")", count);
            return null;
        }
        return new RepeatHeader(target, declared.robotId(), n);
    }

    // digits that do not fit an int are simply out of every range
    private static Integer parseBounded(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
