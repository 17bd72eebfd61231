package armscript;

/** What the executor needs from real or simulated hardware. */
public interface RobotDriver {

    void create(String robotId);

    // seconds each following movement of this robot should take
    void setDelay(String robotId, double seconds);

    void move(String robotId, String component, int value, double seconds);
}
