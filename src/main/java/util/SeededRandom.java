package util;

/**
 * Seedable linear congruential generator used by every randomized filter pass.
 * <p>
 * The register advances with {@code state = (state * 9301 + 49297) mod 233280}
 * and every draw is derived from {@code state / 233280}. The sequence depends
 * only on the seed, so a run can be replayed byte-for-byte on any JVM.
 * <p>
 * One instance belongs to one pipeline invocation. It is not thread-safe and
 * must not be shared between concurrent runs.
 */
public final class SeededRandom {

    public static final long MODULUS = 233_280L;
    public static final long MULTIPLIER = 9_301L;
    public static final long INCREMENT = 49_297L;

    private long state;

    public SeededRandom(long seed) {
        this.state = Math.floorMod(seed, MODULUS);
    }

    /** Next value in [0, 1). */
    public double nextDouble() {
        state = (state * MULTIPLIER + INCREMENT) % MODULUS;
        return state / (double) MODULUS;
    }

    /** Next integer in [min, max], both ends inclusive. */
    public int nextInt(int min, int max) {
        if (min > max)
            throw new IllegalArgumentException("min " + min + " > max " + max);
        double r = nextDouble();
        return (int) Math.floor(min + r * ((long) max - min + 1));
    }

    /** Current register value (for diagnostics and tests). */
    public long state() {
        return state;
    }
}
