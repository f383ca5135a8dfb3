package hw;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BatteryMonitorTest {

    @AfterEach
    void clear() {
        System.clearProperty("forceOnAC");
        System.clearProperty("forceBatteryLevel");
    }

    @Test
    void overridesSkipHardware() {
        System.setProperty("forceOnAC", "false");
        System.setProperty("forceBatteryLevel", "35");
        assertEquals(new BatteryMonitor.PowerState(false, 35), BatteryMonitor.current());

        System.setProperty("forceOnAC", "TRUE");
        assertTrue(BatteryMonitor.onAC());
    }

    @Test
    void levelOverrideIsClamped() {
        System.setProperty("forceBatteryLevel", "250");
        assertEquals(100, BatteryMonitor.levelOrGuess());
        System.setProperty("forceBatteryLevel", "-3");
        assertEquals(0, BatteryMonitor.levelOrGuess());
    }

    @Test
    void realReadingIsInRange() {
        int level = BatteryMonitor.levelOrGuess();
        assertTrue(level >= 0 && level <= 100, "level " + level);
        System.setProperty("forceOnAC", "nonsense");
        assertFalse(BatteryMonitor.onAC());
    }
}
