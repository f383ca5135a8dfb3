package stages;

import static util.PixelBuffer.BLUE;
import static util.PixelBuffer.CHANNELS;
import static util.PixelBuffer.GREEN;
import static util.PixelBuffer.RED;

import util.PixelBuffer;
import util.SeededRandom;

/**
 * Luminance noise: each opaque pixel's brightness is nudged by a random amount
 * in [-strength, strength] and the color channels are scaled by the same
 * ratio, which keeps the hue roughly where it was.
 */
public final class BalancedNoise implements PixelFilter {

    @Override
    public void apply(PixelBuffer buffer, int strength, SeededRandom random) {
        int len = buffer.length();
        for (int i = 0; i < len; i += CHANNELS) {
            if (buffer.isTransparent(i))
                continue;

            int r = buffer.sample(i + RED);
            int g = buffer.sample(i + GREEN);
            int b = buffer.sample(i + BLUE);

            double lum = 0.299 * r + 0.587 * g + 0.114 * b;
            int noise = random.nextInt(-strength, strength);
            double newLum = Math.max(0.0, Math.min(255.0, lum + noise));
            double ratio = lum == 0 ? 1.0 : newLum / lum;

            buffer.setSample(i + RED, (int) (r * ratio));
            buffer.setSample(i + GREEN, (int) (g * ratio));
            buffer.setSample(i + BLUE, (int) (b * ratio));
        }
    }
}
