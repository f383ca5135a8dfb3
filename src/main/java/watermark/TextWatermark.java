package watermark;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

import io.BufferedImages;
import util.PixelBuffer;

/**
 * Tiled circular text watermark: the text is repeated around a ring at the
 * center of every tile, with every other tile row shifted by half a tile.
 * Rendering goes through Java2D, so glyph shapes depend on the installed fonts.
 */
public final class TextWatermark {

    public static final int TILE_SIZE = 300;
    public static final int REPEAT_PER_CIRCLE = 16;

    private TextWatermark() {
    }

    public static PixelBuffer apply(PixelBuffer buffer, String text, double opacity) {
        return apply(buffer, text, opacity, TILE_SIZE, REPEAT_PER_CIRCLE);
    }

    public static PixelBuffer apply(PixelBuffer buffer, String text, double opacity, int tileSize, int repeat) {
        WatermarkCompositor.checkOpacity(opacity);
        if (text == null || text.isEmpty() || opacity == 0)
            return buffer;

        BufferedImage img = BufferedImages.toImage(buffer);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, (float) opacity));
            g.setColor(Color.WHITE);
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, Math.max(12, buffer.width() / 40)));

            FontMetrics fm = g.getFontMetrics();
            float textX = -fm.stringWidth(text) / 2f;
            float textY = (fm.getAscent() - fm.getDescent()) / 2f;
            double radius = tileSize * 0.35;
            AffineTransform base = g.getTransform();

            for (int ty = 0; ty < buffer.height() + tileSize; ty += tileSize) {
                for (int tx = 0; tx < buffer.width() + tileSize; tx += tileSize) {
                    double cx = tx + ((ty / tileSize) % 2 == 0 ? tileSize / 2.0 : 0);
                    double cy = ty;
                    for (int i = 0; i < repeat; i++) {
                        g.setTransform(base);
                        g.translate(cx, cy);
                        g.rotate(2 * Math.PI / repeat * i);
                        g.translate(0, -radius);
                        g.drawString(text, textX, textY);
                    }
                }
            }
        } finally {
            g.dispose();
        }
        BufferedImages.copyInto(img, buffer);
        return buffer;
    }
}
