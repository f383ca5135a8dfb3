package util;

import org.slf4j.Logger;

/** Lap timer that reports elapsed time per stage at DEBUG. */
public class Timing {
    private final Logger log;
    long t0 = System.nanoTime();

    public Timing(Logger log) {
        this.log = log;
    }

    /** Logs the time since the previous lap and returns it in nanoseconds. */
    public long stop(String label) {
        long dt = System.nanoTime() - t0;
        if (log.isDebugEnabled())
            log.debug("{}: {} ms", label, String.format("%.2f", dt / 1_000_000.0));
        t0 = System.nanoTime();
        return dt;
    }
}
