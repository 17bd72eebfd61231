package armscript;

/** How the {@code garra} command is interpreted. Chosen by configuration, never per statement. */
public enum GripperMode {
    ROTATION(0, 360), // gripper treated as wrist rotation, degrees
    OPENING(0, 85);   // gripper opening width, millimetres

    private final int min;
    private final int max;

    GripperMode(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public int min() { return min; }
    public int max() { return max; }
}
