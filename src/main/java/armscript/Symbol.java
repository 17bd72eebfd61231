package armscript;

/**
 * One row of the symbol table: the last validated value of a robot's command.
 * {@code parameter} is 0 for the robot declaration row and 1 for command rows.
 */
public record Symbol(String robotId, String command, int parameter, int value) {

    public static final String ROBOT = "robot";

    public static Symbol declaration(String robotId) {
        return new Symbol(robotId, ROBOT, 0, 0);
    }

    public static Symbol assignment(String robotId, String command, int value) {
        return new Symbol(robotId, command, 1, value);
    }

    @Override
    public String toString() {
        return robotId + "." + command + " [" + parameter + "] = " + value;
    }
}
