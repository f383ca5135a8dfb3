package hw;

import io.BufferedImages;
import util.PixelBuffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.*;
import java.util.Locale;

/**
 * Writes protected buffers to disk and optionally hands them to the desktop
 * viewer. Format follows the extension: {@code .jpg}/{@code .jpeg} write JPEG
 * (alpha flattened onto white), everything else writes PNG.
 */
public class DisplayService {
    private static final Logger LOG = LoggerFactory.getLogger(DisplayService.class);

    public static Path save(PixelBuffer buffer, Path target) throws IOException {
        Path p = target.toAbsolutePath();
        Path parent = p.getParent();
        if (parent != null)
            Files.createDirectories(parent);

        String format = formatFor(p);
        BufferedImage img = BufferedImages.toImage(buffer);
        if (format.equals("jpg"))
            img = flatten(img);
        if (!ImageIO.write(img, format, p.toFile()))
            throw new IOException("No ImageIO writer for format '" + format + "': " + p);
        LOG.debug("Wrote {} as {}", p, format);
        return p;
    }

    public static Path saveAndOpen(PixelBuffer buffer, Path target) throws IOException {
        Path p = save(buffer, target);
        try {
            if (!GraphicsEnvironment.isHeadless() && Desktop.isDesktopSupported())
                Desktop.getDesktop().open(p.toFile());
            else
                LOG.info("No desktop available to open {}", p);
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            LOG.warn("Could not open {}: {}", p, e.getMessage());
        }
        return p;
    }

    static String formatFor(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".jpg") || name.endsWith(".jpeg"))
            return "jpg";
        return "png";
    }

    private static BufferedImage flatten(BufferedImage src) {
        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, src.getWidth(), src.getHeight());
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
