package watermark;

import static util.PixelBuffer.ALPHA;
import static util.PixelBuffer.BLUE;
import static util.PixelBuffer.GREEN;
import static util.PixelBuffer.RED;

import util.InvalidInputException;
import util.PixelBuffer;

/**
 * Burns a watermark image into a protected buffer with source-over alpha
 * blending. The watermark is resampled nearest-neighbour to the placement size
 * and its own alpha is multiplied by {@code opacity}. Anything outside the base
 * image is clipped.
 */
public final class WatermarkCompositor {

    private WatermarkCompositor() {
    }

    public static PixelBuffer composite(PixelBuffer base, Overlay overlay, double opacity) {
        return composite(base, overlay.image(), opacity, overlay.placement());
    }

    public static PixelBuffer composite(PixelBuffer base, PixelBuffer watermark, double opacity, Placement at) {
        if (base == null || watermark == null)
            throw new InvalidInputException("base and watermark must not be null");
        if (at == null)
            throw new InvalidInputException("placement is null");
        checkOpacity(opacity);
        if (opacity == 0)
            return base;

        // only the part of the placement that overlaps the base is visited
        int dyFrom = (int) Math.min(at.height(), Math.max(0, -(long) at.y()));
        int dyTo = (int) Math.min(at.height(), (long) base.height() - at.y());
        int dxFrom = (int) Math.min(at.width(), Math.max(0, -(long) at.x()));
        int dxTo = (int) Math.min(at.width(), (long) base.width() - at.x());

        int ww = watermark.width(), wh = watermark.height();
        for (int dy = dyFrom; dy < dyTo; dy++) {
            int by = at.y() + dy;
            int sy = (int) ((long) dy * wh / at.height());
            for (int dx = dxFrom; dx < dxTo; dx++) {
                int bx = at.x() + dx;
                int sx = (int) ((long) dx * ww / at.width());
                blend(base, base.index(bx, by), watermark, watermark.index(sx, sy), opacity);
            }
        }
        return base;
    }

    private static void blend(PixelBuffer dst, int di, PixelBuffer src, int si, double opacity) {
        double a = src.sample(si + ALPHA) / 255.0 * opacity;
        if (a <= 0)
            return;
        double keep = 1 - a;
        dst.setSample(di + RED, (int) Math.round(src.sample(si + RED) * a + dst.sample(di + RED) * keep));
        dst.setSample(di + GREEN, (int) Math.round(src.sample(si + GREEN) * a + dst.sample(di + GREEN) * keep));
        dst.setSample(di + BLUE, (int) Math.round(src.sample(si + BLUE) * a + dst.sample(di + BLUE) * keep));
        dst.setSample(di + ALPHA, (int) Math.round(255 * (a + dst.sample(di + ALPHA) / 255.0 * keep)));
    }

    public static double checkOpacity(double opacity) {
        if (!(opacity >= 0 && opacity <= 1))
            throw new InvalidInputException("opacity must be in [0..1], got " + opacity);
        return opacity;
    }
}
