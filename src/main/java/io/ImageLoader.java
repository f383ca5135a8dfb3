package io;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import util.PixelBuffer;

public final class ImageLoader {
    private static final Logger LOG = LoggerFactory.getLogger(ImageLoader.class);

    private ImageLoader() {
    }

    /** Decodes any format ImageIO understands (PNG, JPEG, GIF, BMP, ...) into RGBA. */
    public static PixelBuffer load(Path input) throws IOException {
        BufferedImage img;
        try (InputStream in = Files.newInputStream(input)) {
            img = ImageIO.read(in);
        } catch (IOException e) {
            throw new IOException("Failed to read image: " + input + " (" + e.getMessage() + ")", e);
        }
        if (img == null)
            throw new IOException("Unsupported or unrecognised image format: " + input);
        LOG.debug("Loaded {} ({}x{})", input, img.getWidth(), img.getHeight());
        return BufferedImages.toBuffer(img);
    }

    /**
     * Reads only the header to find the image size, without decoding pixels.
     * Returns null when no installed reader recognises the file.
     */
    public static Dimension probe(Path input) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(input.toFile())) {
            if (in == null)
                return null;
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext())
                return null;
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return new Dimension(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        }
    }
}
