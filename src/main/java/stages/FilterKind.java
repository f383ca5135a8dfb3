package stages;

import util.PixelBuffer;
import util.SeededRandom;

/** Identifiers for the protection passes, each bound to its stateless implementation. */
public enum FilterKind {
    BALANCED_NOISE(new BalancedNoise()),
    EDGE_JITTER(new EdgeJitter()),
    TEXTURE_NOISE(new TextureNoise()),
    COLOR_SHIFT(new ColorShift()),
    GEOMETRIC_DISTORTION(new GeometricDistortion()),
    ADVERSARIAL_NOISE(new AdversarialNoise()),
    SINE_INTERFERENCE(new SineInterference()),
    BLOCK_LOCAL_SCRAMBLE(new BlockLocalScramble());

    private final PixelFilter filter;

    FilterKind(PixelFilter filter) {
        this.filter = filter;
    }

    public void apply(PixelBuffer buffer, int strength, SeededRandom random) {
        filter.apply(buffer, strength, random);
    }
}
