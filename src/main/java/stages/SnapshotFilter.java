package stages;

import util.PixelBuffer;
import util.PixelSnapshot;
import util.SeededRandom;

/**
 * Base for passes that move pixels around. The live buffer is frozen into a
 * {@link PixelSnapshot} first; the pass then reads only from the snapshot and
 * writes only to the destination, so no write can feed a later read of the
 * same pass.
 */
public abstract class SnapshotFilter implements PixelFilter {

    @Override
    public final void apply(PixelBuffer buffer, int strength, SeededRandom random) {
        apply(buffer.snapshot(), buffer, strength, random);
    }

    /** Explicit read-source / write-destination form. */
    public final void apply(PixelSnapshot source, PixelBuffer destination, int strength, SeededRandom random) {
        source.requireSameShape(destination);
        transfer(source, destination, strength, random);
    }

    protected abstract void transfer(PixelSnapshot source, PixelBuffer destination, int strength,
            SeededRandom random);
}
