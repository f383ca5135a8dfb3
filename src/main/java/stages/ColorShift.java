package stages;

import static util.PixelBuffer.BLUE;
import static util.PixelBuffer.CHANNELS;
import static util.PixelBuffer.GREEN;
import static util.PixelBuffer.RED;

import util.PixelBuffer;
import util.SeededRandom;

/**
 * Global per-channel cast plus per-sample jitter. The three channel offsets
 * are drawn once in [-strength, strength]; every opaque sample then also gets
 * its own draw in [-strength/2, strength/2].
 */
public final class ColorShift implements PixelFilter {

    @Override
    public void apply(PixelBuffer buffer, int strength, SeededRandom random) {
        int rShift = random.nextInt(-strength, strength);
        int gShift = random.nextInt(-strength, strength);
        int bShift = random.nextInt(-strength, strength);
        int half = strength / 2;

        int len = buffer.length();
        for (int i = 0; i < len; i += CHANNELS) {
            if (buffer.isTransparent(i))
                continue;
            buffer.setSample(i + RED, buffer.sample(i + RED) + rShift + random.nextInt(-half, half));
            buffer.setSample(i + GREEN, buffer.sample(i + GREEN) + gShift + random.nextInt(-half, half));
            buffer.setSample(i + BLUE, buffer.sample(i + BLUE) + bShift + random.nextInt(-half, half));
        }
    }
}
