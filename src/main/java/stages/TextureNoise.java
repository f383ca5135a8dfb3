package stages;

import static util.PixelBuffer.BLUE;
import static util.PixelBuffer.GREEN;
import static util.PixelBuffer.RED;

import util.PixelBuffer;
import util.SeededRandom;

/** Grey noise on every third diagonal; one draw per touched pixel. */
public final class TextureNoise implements PixelFilter {

    @Override
    public void apply(PixelBuffer buffer, int strength, SeededRandom random) {
        int w = buffer.width(), h = buffer.height();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if ((x + y) % 3 != 0)
                    continue;
                int i = buffer.index(x, y);
                if (buffer.isTransparent(i))
                    continue;

                int n = random.nextInt(-strength, strength);
                buffer.setSample(i + RED, buffer.sample(i + RED) + n);
                buffer.setSample(i + GREEN, buffer.sample(i + GREEN) + n);
                buffer.setSample(i + BLUE, buffer.sample(i + BLUE) + n);
            }
        }
    }
}
