package pipeline;

import stages.FilterKind;
import util.PixelBuffer;
import util.SeededRandom;

/** One row of a mode's step table: which pass to run and how strongly. */
public record FilterStep(FilterKind filter, StrengthScale scale) {

    public static FilterStep of(FilterKind filter, StrengthScale scale) {
        return new FilterStep(filter, scale);
    }

    public int strengthFor(int strength) {
        return scale.apply(strength);
    }

    public void run(PixelBuffer buffer, int strength, SeededRandom random) {
        filter.apply(buffer, strengthFor(strength), random);
    }

    @Override
    public String toString() {
        return filter + "(" + scale + ")";
    }
}
