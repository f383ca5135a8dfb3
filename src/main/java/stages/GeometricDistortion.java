package stages;

import util.PixelBuffer;
import util.PixelSnapshot;
import util.SeededRandom;

/**
 * Sinusoidal warp. Rows are displaced horizontally by a sine of y and columns
 * vertically by a cosine of x; each destination pixel is a straight copy
 * (alpha included) of one snapshot pixel, never a blend.
 * <p>
 * Four draws per pass, in order: x frequency, x phase, y frequency, y phase.
 */
public final class GeometricDistortion extends SnapshotFilter {

    @Override
    protected void transfer(PixelSnapshot source, PixelBuffer destination, int strength, SeededRandom random) {
        int w = source.width(), h = source.height();

        double amplitude = strength * 0.5;
        double freqX = 0.05 + random.nextDouble() * 0.1;
        double phaseX = random.nextDouble() * 10;
        double freqY = 0.05 + random.nextDouble() * 0.1;
        double phaseY = random.nextDouble() * 10;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double offX = amplitude * StrictMath.sin(freqX * y + phaseX);
                double offY = amplitude * StrictMath.cos(freqY * x + phaseY);

                int sx = clampCoord(x + (int) Math.floor(offX), w);
                int sy = clampCoord(y + (int) Math.floor(offY), h);

                destination.copyPixel(source, source.index(sx, sy), destination.index(x, y));
            }
        }
    }

    private static int clampCoord(int v, int size) {
        return (v < 0) ? 0 : (v >= size) ? size - 1 : v;
    }
}
