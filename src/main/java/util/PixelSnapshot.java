package util;

/**
 * Frozen copy of a {@link PixelBuffer}, taken before a spatial pass and used
 * as that pass's only read source.
 */
public final class PixelSnapshot {

    private final int width;
    private final int height;
    final byte[] samples;

    PixelSnapshot(int width, int height, byte[] samples) {
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int index(int x, int y) {
        return (y * width + x) * PixelBuffer.CHANNELS;
    }

    public int sample(int index) {
        return samples[index] & 0xFF;
    }

    /** Packed RGBA of the pixel starting at {@code index}. */
    public int pixel(int index) {
        return ((samples[index] & 0xFF) << 24)
                | ((samples[index + 1] & 0xFF) << 16)
                | ((samples[index + 2] & 0xFF) << 8)
                | (samples[index + 3] & 0xFF);
    }

    /**
     * Guards the read-source / write-destination pairing of a spatial pass.
     * A mismatch is a programming error, never bad user input.
     */
    public void requireSameShape(PixelBuffer destination) {
        if (destination.width() != width || destination.height() != height)
            throw new IllegalStateException("snapshot " + width + "x" + height
                    + " does not match destination " + destination.width() + "x" + destination.height());
    }
}
