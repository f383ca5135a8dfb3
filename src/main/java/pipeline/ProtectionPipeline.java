package pipeline;

import static pipeline.FilterStep.of;
import static pipeline.StrengthScale.divide;
import static pipeline.StrengthScale.full;
import static pipeline.StrengthScale.times;
import static stages.FilterKind.ADVERSARIAL_NOISE;
import static stages.FilterKind.BALANCED_NOISE;
import static stages.FilterKind.BLOCK_LOCAL_SCRAMBLE;
import static stages.FilterKind.COLOR_SHIFT;
import static stages.FilterKind.EDGE_JITTER;
import static stages.FilterKind.GEOMETRIC_DISTORTION;
import static stages.FilterKind.SINE_INTERFERENCE;
import static stages.FilterKind.TEXTURE_NOISE;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import util.InvalidInputException;
import util.PixelBuffer;
import util.SeededRandom;
import util.Timing;

/**
 * Runs the protection passes selected by a {@link ProtectionMode}.
 * <p>
 * Which passes run, in which order and at which strength is pure data (the
 * step table below). Passes are not commutative, so steps always run one
 * after another on the caller's thread. A run owns its buffer and generator
 * for its whole duration; identical (buffer, mode, strength, seed) inputs
 * always produce identical bytes.
 */
public final class ProtectionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ProtectionPipeline.class);

    public static final int MIN_STRENGTH = 0;
    public static final int MAX_STRENGTH = 50;

    private static final Map<ProtectionMode, List<FilterStep>> STEPS = table();

    private ProtectionPipeline() {
    }

    private static Map<ProtectionMode, List<FilterStep>> table() {
        Map<ProtectionMode, List<FilterStep>> t = new EnumMap<>(ProtectionMode.class);
        t.put(ProtectionMode.SOFT, List.of(
                of(BALANCED_NOISE, divide(2)),
                of(COLOR_SHIFT, divide(4))));
        t.put(ProtectionMode.BALANCED, List.of(
                of(BALANCED_NOISE, full()),
                of(EDGE_JITTER, divide(2)),
                of(ADVERSARIAL_NOISE, divide(3))));
        t.put(ProtectionMode.STRONG, List.of(
                of(BALANCED_NOISE, full()),
                of(EDGE_JITTER, full()),
                of(TEXTURE_NOISE, divide(2)),
                of(COLOR_SHIFT, divide(2)),
                of(GEOMETRIC_DISTORTION, divide(5))));
        t.put(ProtectionMode.AI_POISON, List.of(
                of(SINE_INTERFERENCE, times(0.5)),
                of(GEOMETRIC_DISTORTION, times(0.5)),
                of(ADVERSARIAL_NOISE, times(0.8)),
                of(COLOR_SHIFT, times(0.8)),
                of(BLOCK_LOCAL_SCRAMBLE, times(0.5))));
        return Collections.unmodifiableMap(t);
    }

    /** Ordered steps for a mode. */
    public static List<FilterStep> steps(ProtectionMode mode) {
        return STEPS.get(mode);
    }

    public static PixelBuffer protect(PixelBuffer buffer, int modeIndex, int strength, long seed) {
        return protect(buffer, ProtectionMode.fromIndex(modeIndex), strength, seed);
    }

    /**
     * Protects {@code buffer} in place and returns it.
     *
     * @throws InvalidInputException if the buffer or mode is missing or the
     *                               strength is outside [0, 50]; nothing is
     *                               modified in that case
     */
    public static PixelBuffer protect(PixelBuffer buffer, ProtectionMode mode, int strength, long seed) {
        validate(buffer, mode, strength);

        SeededRandom random = new SeededRandom(seed);
        Timing timing = new Timing(LOG);
        List<FilterStep> steps = steps(mode);
        for (FilterStep step : steps) {
            step.run(buffer, strength, random);
            timing.stop(step.toString());
        }
        LOG.debug("Protected {} mode={} strength={} seed={} steps={}", buffer, mode, strength, seed, steps.size());
        return buffer;
    }

    static void validate(PixelBuffer buffer, ProtectionMode mode, int strength) {
        if (buffer == null)
            throw new InvalidInputException("buffer is null");
        if (mode == null)
            throw new InvalidInputException("mode is null");
        checkStrength(strength);
    }

    public static int checkStrength(int strength) {
        if (strength < MIN_STRENGTH || strength > MAX_STRENGTH)
            throw new InvalidInputException(
                    "strength must be in [" + MIN_STRENGTH + ".." + MAX_STRENGTH + "], got " + strength);
        return strength;
    }
}
