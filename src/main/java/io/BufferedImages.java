package io;

import java.awt.image.BufferedImage;

import util.PixelBuffer;

/** Conversions between AWT images (packed ARGB) and RGBA {@link PixelBuffer}s, one row at a time. */
public final class BufferedImages {

    private BufferedImages() {
    }

    public static PixelBuffer toBuffer(BufferedImage src) {
        PixelBuffer out = PixelBuffer.allocate(src.getWidth(), src.getHeight());
        copyInto(src, out);
        return out;
    }

    /** Overwrites {@code dst} with the pixels of {@code src}; sizes must match. */
    public static void copyInto(BufferedImage src, PixelBuffer dst) {
        int w = src.getWidth(), h = src.getHeight();
        if (w != dst.width() || h != dst.height())
            throw new IllegalStateException("image " + w + "x" + h + " does not match " + dst);
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            src.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int p = row[x];
                // ARGB -> RGBA
                dst.setPixel(dst.index(x, y), (p << 8) | (p >>> 24));
            }
        }
    }

    public static BufferedImage toImage(PixelBuffer src) {
        int w = src.width(), h = src.height();
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int p = src.pixel(src.index(x, y));
                // RGBA -> ARGB
                row[x] = (p >>> 8) | (p << 24);
            }
            out.setRGB(0, y, w, 1, row, 0, w);
        }
        return out;
    }
}
