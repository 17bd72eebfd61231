package armscript;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

// seconds per movement currently in effect for each robot
final class VelocityRegistry {
    private final Map<String, Double> delays = new HashMap<>();
    private final double defaultDelay;

    VelocityRegistry(double defaultDelay) {
        this.defaultDelay = defaultDelay;
    }

    void register(String robot) {
        delays.put(key(robot), defaultDelay);
    }

    void set(String robot, double seconds) {
        String k = key(robot);
        if (!delays.containsKey(k)) {
            throw new IllegalStateException("no velocity entry for undeclared robot " + robot);
        }
        delays.put(k, seconds);
    }

    double delayOf(String robot) {
        Double d = delays.get(key(robot));
        if (d == null) {
            throw new IllegalStateException("no velocity entry for undeclared robot " + robot);
        }
        return d;
    }

    private static String key(String robot) {
        return robot.toLowerCase(Locale.ROOT);
    }
}
