package watermark;

import util.InvalidInputException;
import util.PixelBuffer;

/** Destination rectangle of a watermark, in image pixel space. May extend past the image. */
public record Placement(int x, int y, int width, int height) {

    public Placement {
        if (width <= 0 || height <= 0)
            throw new InvalidInputException("placement size must be positive, got " + width + "x" + height);
    }

    /**
     * Places {@code watermark} at (x, y) resized by {@code scale}; size rounds
     * to at least 1x1 and saturates at {@code Integer.MAX_VALUE}.
     */
    public static Placement scaled(int x, int y, double scale, PixelBuffer watermark) {
        if (!(scale > 0) || Double.isInfinite(scale))
            throw new InvalidInputException("scale must be a positive number, got " + scale);
        int w = (int) Math.max(1, Math.min(Integer.MAX_VALUE, Math.round(watermark.width() * scale)));
        int h = (int) Math.max(1, Math.min(Integer.MAX_VALUE, Math.round(watermark.height() * scale)));
        return new Placement(x, y, w, h);
    }
}
