package util;

import java.util.Arrays;

/**
 * Width x height grid of RGBA samples stored row-major in one byte array.
 * <p>
 * Length is always {@code width * height * 4} and dimensions never change.
 * Writes saturate into [0, 255], so every stored channel stays in range no
 * matter what arithmetic a filter does.
 */
public final class PixelBuffer {

    public static final int CHANNELS = 4;
    public static final int RED = 0;
    public static final int GREEN = 1;
    public static final int BLUE = 2;
    public static final int ALPHA = 3;

    private final int width;
    private final int height;
    private final byte[] samples;

    private PixelBuffer(int width, int height, byte[] samples) {
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    // ---------------- Factories ----------------

    /** New fully transparent black buffer. */
    public static PixelBuffer allocate(int width, int height) {
        checkDimensions(width, height);
        return new PixelBuffer(width, height, new byte[width * height * CHANNELS]);
    }

    /** Wraps (does not copy) a caller-owned RGBA array. */
    public static PixelBuffer wrap(int width, int height, byte[] rgba) {
        checkDimensions(width, height);
        if (rgba == null)
            throw new InvalidInputException("pixel data is null");
        int expected = width * height * CHANNELS;
        if (rgba.length != expected)
            throw new InvalidInputException("pixel data length " + rgba.length
                    + " does not match " + width + "x" + height + "x" + CHANNELS + " = " + expected);
        return new PixelBuffer(width, height, rgba);
    }

    private static void checkDimensions(int width, int height) {
        if (width <= 0 || height <= 0)
            throw new InvalidInputException("dimensions must be positive, got " + width + "x" + height);
        if ((long) width * height * CHANNELS > Integer.MAX_VALUE)
            throw new InvalidInputException("image too large: " + width + "x" + height);
    }

    // ---------------- Geometry ----------------

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** Number of samples, always width * height * 4. */
    public int length() {
        return samples.length;
    }

    /** Offset of the first (red) sample of pixel (x, y). */
    public int index(int x, int y) {
        return (y * width + x) * CHANNELS;
    }

    // ---------------- Samples ----------------

    public int sample(int index) {
        return samples[index] & 0xFF;
    }

    public void setSample(int index, int value) {
        samples[index] = (byte) clamp(value);
    }

    public int sample(int x, int y, int channel) {
        return sample(index(x, y) + channel);
    }

    public void setSample(int x, int y, int channel, int value) {
        setSample(index(x, y) + channel, value);
    }

    /** True when the pixel starting at {@code index} has zero alpha. */
    public boolean isTransparent(int index) {
        return samples[index + ALPHA] == 0;
    }

    /** Packed RGBA ({@code 0xRRGGBBAA}) of the pixel starting at {@code index}. */
    public int pixel(int index) {
        return ((samples[index] & 0xFF) << 24)
                | ((samples[index + 1] & 0xFF) << 16)
                | ((samples[index + 2] & 0xFF) << 8)
                | (samples[index + 3] & 0xFF);
    }

    public void setPixel(int index, int rgba) {
        samples[index] = (byte) (rgba >>> 24);
        samples[index + 1] = (byte) (rgba >>> 16);
        samples[index + 2] = (byte) (rgba >>> 8);
        samples[index + 3] = (byte) rgba;
    }

    /** Copies all four channels of one snapshot pixel into this buffer. */
    public void copyPixel(PixelSnapshot source, int sourceIndex, int destIndex) {
        System.arraycopy(source.samples, sourceIndex, samples, destIndex, CHANNELS);
    }

    // ---------------- Copies ----------------

    public PixelSnapshot snapshot() {
        return new PixelSnapshot(width, height, samples.clone());
    }

    public PixelBuffer copy() {
        return new PixelBuffer(width, height, samples.clone());
    }

    public byte[] toByteArray() {
        return samples.clone();
    }

    public boolean sameContent(PixelBuffer other) {
        return other != null && width == other.width && height == other.height
                && Arrays.equals(samples, other.samples);
    }

    public static int clamp(int v) {
        return (v < 0) ? 0 : (v > 255) ? 255 : v;
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "]";
    }
}
