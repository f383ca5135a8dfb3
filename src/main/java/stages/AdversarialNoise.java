package stages;

import static util.PixelBuffer.BLUE;
import static util.PixelBuffer.CHANNELS;
import static util.PixelBuffer.GREEN;
import static util.PixelBuffer.RED;

import util.PixelBuffer;
import util.SeededRandom;

/**
 * Perceptual-masking grid noise.
 * <p>
 * Local variance (mean of the absolute RGB difference to the left and upper
 * neighbours) picks a multiplier: 0.2 in flat areas, 1.0 above 10, 2.5 above
 * 40. Grid lines every {@value #CELL_SIZE} pixels are darkened; inside the
 * cells a checkerboard pushes red up and green down.
 * <p>
 * The sweep runs in place, so neighbours to the left and above have already
 * been modified when a pixel is evaluated. Output depends on that order.
 * No draws are taken from the generator.
 */
public final class AdversarialNoise implements PixelFilter {

    static final int CELL_SIZE = 4;

    @Override
    public void apply(PixelBuffer buffer, int strength, SeededRandom random) {
        int w = buffer.width(), h = buffer.height();
        int stride = w * CHANNELS;

        for (int y = 1; y < h; y++) {
            for (int x = 1; x < w; x++) {
                int i = buffer.index(x, y);
                if (buffer.isTransparent(i))
                    continue;

                int diffL = difference(buffer, i, i - CHANNELS);
                int diffU = difference(buffer, i, i - stride);
                int variance = (diffL + diffU) / 2;

                double multiplier = 0.2;
                if (variance > 10)
                    multiplier = 1.0;
                if (variance > 40)
                    multiplier = 2.5;
                int effective = (int) (strength * multiplier);

                if (x % CELL_SIZE == 0 || y % CELL_SIZE == 0) {
                    int shift = (int) (-effective * 0.5);
                    buffer.setSample(i + RED, buffer.sample(i + RED) + shift);
                    buffer.setSample(i + GREEN, buffer.sample(i + GREEN) + shift);
                    buffer.setSample(i + BLUE, buffer.sample(i + BLUE) + shift);
                } else if ((x / CELL_SIZE + y / CELL_SIZE) % 2 == 0) {
                    int shift = (int) (effective * 0.4);
                    buffer.setSample(i + RED, buffer.sample(i + RED) + shift);
                    buffer.setSample(i + GREEN, buffer.sample(i + GREEN) - shift);
                }
            }
        }
    }

    private static int difference(PixelBuffer buffer, int a, int b) {
        return Math.abs(buffer.sample(a + RED) - buffer.sample(b + RED))
                + Math.abs(buffer.sample(a + GREEN) - buffer.sample(b + GREEN))
                + Math.abs(buffer.sample(a + BLUE) - buffer.sample(b + BLUE));
    }
}
