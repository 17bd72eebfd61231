package armscript;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings that shape validation and code generation. Loaded from
 * {@code armscript.properties} on the classpath; a system property of the same
 * name wins over the file.
 */
public final class AnalyzerConfig {

    public static final String RESOURCE = "armscript.properties";
    public static final String GRIPPER_MODE_KEY = "armscript.gripper.mode";
    public static final String DEFAULT_DELAY_KEY = "armscript.default.delay";

    public static final double DEFAULT_DELAY_SECONDS = 5.0;

    private final GripperMode gripperMode;
    private final double defaultDelaySeconds;

    public AnalyzerConfig(GripperMode gripperMode, double defaultDelaySeconds) {
        this.gripperMode = Objects.requireNonNull(gripperMode);
        if (!(defaultDelaySeconds > 0)) {
            throw new IllegalArgumentException("default delay must be positive: " + defaultDelaySeconds);
        }
        this.defaultDelaySeconds = defaultDelaySeconds;
    }

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(GripperMode.ROTATION, DEFAULT_DELAY_SECONDS);
    }

    public static AnalyzerConfig load() {
        Properties props = new Properties();
        try (InputStream in = AnalyzerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + RESOURCE, e);
        }
        return fromProperties(props);
    }

    static AnalyzerConfig fromProperties(Properties props) {
        String mode = System.getProperty(GRIPPER_MODE_KEY, props.getProperty(GRIPPER_MODE_KEY));
        String delay = System.getProperty(DEFAULT_DELAY_KEY, props.getProperty(DEFAULT_DELAY_KEY));

        GripperMode gm = GripperMode.ROTATION;
        if (mode != null && !mode.isBlank()) {
            try {
                gm = GripperMode.valueOf(mode.strip().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown " + GRIPPER_MODE_KEY + ": " + mode, e);
            }
        }

        double d = DEFAULT_DELAY_SECONDS;
        if (delay != null && !delay.isBlank()) {
            try {
                d = Double.parseDouble(delay.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("malformed " + DEFAULT_DELAY_KEY + ": " + delay, e);
            }
        }
        return new AnalyzerConfig(gm, d);
    }

    public GripperMode gripperMode() { return gripperMode; }
    public double defaultDelaySeconds() { return defaultDelaySeconds; }

    @Override
    public String toString() {
        return "AnalyzerConfig[gripperMode=" + gripperMode + ", defaultDelaySeconds=" + defaultDelaySeconds + "]";
    }
}
