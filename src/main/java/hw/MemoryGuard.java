package hw;

/**
 * Caps how many protection jobs may hold their buffers in memory at once.
 * A job needs its live RGBA buffer plus one snapshot for the spatial pass in
 * progress, plus a fixed overhead.
 */
public class MemoryGuard {
    private final long softCapBytes;
    private final long jobOverheadBytes;

    /** Soft cap as a fraction of the heap still free at construction time. */
    public MemoryGuard(double fractionOfFree, long jobOverheadBytes) {
        this(heapCap(fractionOfFree), jobOverheadBytes);
    }

    private MemoryGuard(long softCapBytes, long jobOverheadBytes) {
        this.softCapBytes = softCapBytes;
        this.jobOverheadBytes = jobOverheadBytes;
    }

    private static long heapCap(double fractionOfFree) {
        long freeAtStart = Runtime.getRuntime().maxMemory()
                - (Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory());
        if (freeAtStart <= 0)
            freeAtStart = 256L * 1024 * 1024; // fallback 256MB
        return (long) Math.max(64L * 1024 * 1024, freeAtStart * fractionOfFree); // at least 64MB
    }

    /** Guard with a fixed cap, independent of the current heap. */
    public static MemoryGuard withCap(long softCapBytes, long jobOverheadBytes) {
        if (softCapBytes <= 0)
            throw new IllegalArgumentException("cap must be positive: " + softCapBytes);
        return new MemoryGuard(softCapBytes, jobOverheadBytes);
    }

    /** Jobs of {@code jobBytes} that fit under the cap together; never less than one. */
    public int maxConcurrent(long jobBytes) {
        long per = Math.max(1, jobBytes + jobOverheadBytes);
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, softCapBytes / per));
    }

    /** RGBA buffer plus one full snapshot. */
    public static long estimateJobBytes(int w, int h) {
        return (long) w * (long) h * 4L * 2L;
    }

    public long getSoftCapBytes() {
        return softCapBytes;
    }
}
