package armscript;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed command vocabulary of a robot and the range each value must fall in.
 * {@code garra} takes its bounds from the configured {@link GripperMode}.
 */
public enum Command {

    BASE("base", 0, 360, true),
    HOMBRO("hombro", 0, 180, true),
    CODO("codo", 0, 180, true),
    GARRA("garra", 0, 360, true),
    VELOCIDAD("velocidad", 1, 100, false),
    REPETIR("repetir", 1, 100, false);

    private final String keyword;
    private final int min;
    private final int max;
    private final boolean negatable;

    Command(String keyword, int min, int max, boolean negatable) {
        this.keyword = keyword;
        this.min = min;
        this.max = max;
        this.negatable = negatable;
    }

    public String keyword() { return keyword; }

    // only joint movements accept the .negativo suffix
    public boolean negatable() { return negatable; }

    public boolean isMovement() {
        return this != VELOCIDAD && this != REPETIR;
    }

    public int min(GripperMode mode) {
        return this == GARRA ? mode.min() : min;
    }

    public int max(GripperMode mode) {
        return this == GARRA ? mode.max() : max;
    }

    public boolean inRange(int magnitude, GripperMode mode) {
        return magnitude >= min(mode) && magnitude <= max(mode);
    }

    public static Optional<Command> fromKeyword(String s) {
        if (s == null) return Optional.empty();
        String k = s.toLowerCase(Locale.ROOT);
        for (Command c : values()) {
            if (c.keyword.equals(k)) return Optional.of(c);
        }
        return Optional.empty();
    }
}
