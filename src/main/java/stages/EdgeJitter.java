package stages;

import util.PixelBuffer;
import util.PixelSnapshot;
import util.SeededRandom;

/**
 * Diagonal smear: every pixel with {@code (x + y) % 4 == 0} (outer border
 * excluded) is copied one step to the right. Strength is accepted for a
 * uniform signature but has no effect.
 */
public final class EdgeJitter extends SnapshotFilter {

    @Override
    protected void transfer(PixelSnapshot source, PixelBuffer destination, int strength, SeededRandom random) {
        int w = source.width(), h = source.height();
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                if ((x + y) % 4 != 0)
                    continue;
                destination.copyPixel(source, source.index(x, y), destination.index(x + 1, y));
            }
        }
    }
}
