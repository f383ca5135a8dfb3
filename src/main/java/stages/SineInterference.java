package stages;

import static util.PixelBuffer.BLUE;
import static util.PixelBuffer.GREEN;
import static util.PixelBuffer.RED;

import util.PixelBuffer;
import util.SeededRandom;

/** Diagonal brightness wave with a 20 pixel period. Fully deterministic. */
public final class SineInterference implements PixelFilter {

    static final double PERIOD = 20.0;

    @Override
    public void apply(PixelBuffer buffer, int strength, SeededRandom random) {
        int w = buffer.width(), h = buffer.height();
        double amplitude = strength * 0.8;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = buffer.index(x, y);
                if (buffer.isTransparent(i))
                    continue;

                int wave = (int) (StrictMath.sin((x + y) / PERIOD * 2 * Math.PI) * amplitude);
                buffer.setSample(i + RED, buffer.sample(i + RED) + wave);
                buffer.setSample(i + GREEN, buffer.sample(i + GREEN) + wave);
                buffer.setSample(i + BLUE, buffer.sample(i + BLUE) + wave);
            }
        }
    }
}
