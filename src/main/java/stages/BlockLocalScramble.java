package stages;

import util.PixelBuffer;
import util.PixelSnapshot;
import util.SeededRandom;
import util.Tiles;

/**
 * Shuffles whole pixels inside small square tiles. Tile edge is
 * {@code clamp(strength / 10 + 2, 2, 6)}; each tile is permuted with a
 * Fisher-Yates pass driven by the generator, so the set of pixel values per
 * tile never changes.
 */
public final class BlockLocalScramble extends SnapshotFilter {

    static final int MIN_BLOCK = 2;
    static final int MAX_BLOCK = 6;
    // scratch capacity, well above MAX_BLOCK
    private static final int SCRATCH_EDGE = 16;

    static int blockSize(int strength) {
        return Math.min(MAX_BLOCK, Math.max(MIN_BLOCK, strength / 10 + 2));
    }

    @Override
    protected void transfer(PixelSnapshot source, PixelBuffer destination, int strength, SeededRandom random) {
        int size = blockSize(strength);
        int[] block = new int[SCRATCH_EDGE * SCRATCH_EDGE];

        for (Tiles.Tile t : Tiles.grid(source.width(), source.height(), size, size)) {
            if (t.area() > block.length)
                throw new IllegalStateException("tile " + t + " exceeds scratch capacity");

            int count = 0;
            for (int y = t.y(); y < t.y() + t.height(); y++)
                for (int x = t.x(); x < t.x() + t.width(); x++)
                    block[count++] = source.pixel(source.index(x, y));

            for (int i = count - 1; i > 0; i--) {
                int j = random.nextInt(0, i);
                int tmp = block[i];
                block[i] = block[j];
                block[j] = tmp;
            }

            int k = 0;
            for (int y = t.y(); y < t.y() + t.height(); y++)
                for (int x = t.x(); x < t.x() + t.width(); x++)
                    destination.setPixel(destination.index(x, y), block[k++]);
        }
    }
}
