package stages;

import util.PixelBuffer;
import util.SeededRandom;

/**
 * One protection pass. Implementations are stateless: everything a pass needs
 * arrives as arguments, and the only side effects are writes into
 * {@code buffer} and draws from {@code random}.
 */
public interface PixelFilter {

    void apply(PixelBuffer buffer, int strength, SeededRandom random);
}
