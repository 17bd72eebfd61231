package armscript;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AnalyzerConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(AnalyzerConfig.GRIPPER_MODE_KEY);
        System.clearProperty(AnalyzerConfig.DEFAULT_DELAY_KEY);
    }

    @Test
    void emptyPropertiesGiveDefaults() {
        AnalyzerConfig c = AnalyzerConfig.fromProperties(new Properties());
        assertEquals(GripperMode.ROTATION, c.gripperMode());
        assertEquals(5.0, c.defaultDelaySeconds());
    }

    @Test
    void bundledResourceLoads() {
        AnalyzerConfig c = AnalyzerConfig.load();
        assertEquals(GripperMode.ROTATION, c.gripperMode());
        assertEquals(5.0, c.defaultDelaySeconds());
    }

    @Test
    void valuesAreReadFromProperties() {
        Properties p = new Properties();
        p.setProperty(AnalyzerConfig.GRIPPER_MODE_KEY, " opening ");
        p.setProperty(AnalyzerConfig.DEFAULT_DELAY_KEY, "2.5");

        AnalyzerConfig c = AnalyzerConfig.fromProperties(p);
        assertEquals(GripperMode.OPENING, c.gripperMode());
        assertEquals(2.5, c.defaultDelaySeconds());
    }

    @Test
    void systemPropertyWins() {
        Properties p = new Properties();
        p.setProperty(AnalyzerConfig.GRIPPER_MODE_KEY, "ROTATION");
        System.setProperty(AnalyzerConfig.GRIPPER_MODE_KEY, "OPENING");

        assertEquals(GripperMode.OPENING, AnalyzerConfig.fromProperties(p).gripperMode());
    }

    @Test
    void malformedValuesAreRejected() {
        Properties mode = new Properties();
        mode.setProperty(AnalyzerConfig.GRIPPER_MODE_KEY, "claw");
        assertThrows(IllegalArgumentException.class, () -> AnalyzerConfig.fromProperties(mode));

        Properties delay = new Properties();
        delay.setProperty(AnalyzerConfig.DEFAULT_DELAY_KEY, "fast");
        assertThrows(IllegalArgumentException.class, () -> AnalyzerConfig.fromProperties(delay));

        assertThrows(IllegalArgumentException.class, () -> new AnalyzerConfig(GripperMode.ROTATION, 0));
    }
}
