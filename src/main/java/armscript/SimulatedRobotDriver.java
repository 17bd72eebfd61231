package armscript;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// driver without hardware, records every call so a run can be inspected afterwards
public class SimulatedRobotDriver implements RobotDriver {
    private static final Logger log = LoggerFactory.getLogger(SimulatedRobotDriver.class);

    public record Motion(String robotId, String component, int value, double seconds) {
        @Override
        public String toString() {
            return robotId + "." + component + " -> " + value + " (" + seconds + "s)";
        }
    }

    private final List<String> robots = new ArrayList<>();
    private final List<Motion> motions = new ArrayList<>();
    private double simulatedSeconds = 0;

    @Override
    public void create(String robotId) {
        robots.add(robotId);
        log.info("[simulation] robot {} ready", robotId);
    }

    @Override
    public void setDelay(String robotId, double seconds) {
        log.debug("[simulation] {} delay {}s", robotId, seconds);
    }

    @Override
    public void move(String robotId, String component, int value, double seconds) {
        Motion m = new Motion(robotId, component, value, seconds);
        motions.add(m);
        simulatedSeconds += seconds;
        log.info("[simulation] {}", m);
    }

    public List<String> robots() { return Collections.unmodifiableList(robots); }
    public List<Motion> motions() { return Collections.unmodifiableList(motions); }
    public double simulatedSeconds() { return simulatedSeconds; }
}
