package io;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.Dimension;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import hw.DisplayService;
import util.PixelBuffer;
import util.TestBuffers;

class ImageLoaderTest {

    @TempDir
    Path dir;

    @Test
    void pngRoundTripIsLossless() throws IOException {
        PixelBuffer img = TestBuffers.noisy(13, 7, 42);
        Path file = DisplayService.save(img, dir.resolve("a.png"));

        assertArrayEquals(img.toByteArray(), ImageLoader.load(file).toByteArray());
        assertEquals(new Dimension(13, 7), ImageLoader.probe(file));
    }

    @Test
    void unrecognisedFile() throws IOException {
        Path junk = Files.writeString(dir.resolve("junk.png"), "hello");
        assertThrows(IOException.class, () -> ImageLoader.load(junk));
        assertNull(ImageLoader.probe(junk));
    }

    @Test
    void missingFile() {
        assertThrows(IOException.class, () -> ImageLoader.load(dir.resolve("nope.png")));
    }
}
