package hw;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import oshi.SystemInfo;
import oshi.hardware.PowerSource;

import java.util.List;

/**
 * Power readings used to size the batch worker pool.
 * <p>
 * {@code -DforceOnAC=true|false} and {@code -DforceBatteryLevel=0..100}
 * override the OSHI readings. If OSHI is unavailable on the platform the
 * monitor assumes a desktop on mains power.
 */
public final class BatteryMonitor {
    private static final Logger LOG = LoggerFactory.getLogger(BatteryMonitor.class);

    public record PowerState(boolean onAC, int batteryPercent) {
    }

    private BatteryMonitor() {
    }

    // OSHI is initialised on first real query, never when overrides are set
    private static final class Hal {
        static final SystemInfo SI = new SystemInfo();
    }

    public static PowerState current() {
        return new PowerState(onAC(), levelOrGuess());
    }

    public static boolean onAC() {
        String override = System.getProperty("forceOnAC");
        if (override != null)
            return Boolean.parseBoolean(override.trim());

        try {
            List<PowerSource> ps = Hal.SI.getHardware().getPowerSources();
            if (ps.isEmpty())
                return true; // desktop

            for (PowerSource p : ps) {
                if (p.isPowerOnLine())
                    return true;
            }
            return false;
        } catch (RuntimeException | LinkageError e) {
            LOG.debug("Power source query failed, assuming AC: {}", e.toString());
            return true;
        }
    }

    public static int levelOrGuess() {
        String lvl = System.getProperty("forceBatteryLevel");
        if (lvl != null) {
            try {
                int v = Integer.parseInt(lvl.trim());
                return Math.max(0, Math.min(100, v));
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring forceBatteryLevel='{}': not an integer", lvl);
            }
        }

        try {
            List<PowerSource> ps = Hal.SI.getHardware().getPowerSources();
            double sum = 0;
            int n = 0;
            for (PowerSource p : ps) {
                double pct = p.getRemainingCapacityPercent();
                if (!Double.isNaN(pct)) {
                    sum += pct;
                    n++;
                }
            }
            if (n == 0)
                return 100;
            return (int) Math.round((sum / n) * 100.0);
        } catch (RuntimeException | LinkageError e) {
            LOG.debug("Battery level query failed, assuming 100%: {}", e.toString());
            return 100;
        }
    }
}
