package watermark;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import util.InvalidInputException;
import util.PixelBuffer;
import util.TestBuffers;

class WatermarkCompositorTest {

    private static PixelBuffer grey(int w, int h) {
        PixelBuffer b = PixelBuffer.allocate(w, h);
        for (int i = 0; i < b.length(); i += 4) {
            b.setSample(i, 100);
            b.setSample(i + 1, 100);
            b.setSample(i + 2, 100);
            b.setSample(i + 3, 255);
        }
        return b;
    }

    @Test
    void sourceOverAtHalfOpacity() {
        PixelBuffer base = grey(1, 1);
        PixelBuffer wm = TestBuffers.of(1, 1, 200, 0, 50, 255);
        WatermarkCompositor.composite(base, wm, 0.5, new Placement(0, 0, 1, 1));
        assertArrayEquals(new int[] { 150, 50, 75, 255 }, TestBuffers.samples(base));
    }

    @Test
    void watermarkAlphaMultipliesOpacity() {
        PixelBuffer base = grey(1, 1);
        PixelBuffer wm = TestBuffers.of(1, 1, 200, 200, 200, 0);
        WatermarkCompositor.composite(base, wm, 1.0, new Placement(0, 0, 1, 1));
        assertArrayEquals(new int[] { 100, 100, 100, 255 }, TestBuffers.samples(base));
    }

    @Test
    void transparentBaseTakesWatermarkAlpha() {
        PixelBuffer base = TestBuffers.of(1, 1, 0, 0, 0, 0);
        PixelBuffer wm = TestBuffers.of(1, 1, 255, 255, 255, 255);
        WatermarkCompositor.composite(base, wm, 0.2, new Placement(0, 0, 1, 1));
        assertArrayEquals(new int[] { 51, 51, 51, 51 }, TestBuffers.samples(base));
    }

    @Test
    void nearestNeighbourUpscale() {
        PixelBuffer base = grey(4, 2);
        PixelBuffer wm = TestBuffers.of(2, 1, 255, 0, 0, 255, 0, 0, 255, 255);
        WatermarkCompositor.composite(base, new Overlay(wm, 0, 0, 2.0), 1.0);
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 4; x++) {
                int expectedRed = x < 2 ? 255 : 0;
                assertEquals(expectedRed, base.sample(x, y, PixelBuffer.RED), x + "," + y);
                assertEquals(255 - expectedRed, base.sample(x, y, PixelBuffer.BLUE), x + "," + y);
            }
        }
    }

    @Test
    void clipsAtImageEdges() {
        PixelBuffer base = grey(3, 3);
        // 2x2 watermark, only its bottom-right pixel lands on (0,0)
        PixelBuffer wm = TestBuffers.of(2, 2,
                10, 10, 10, 255, 20, 20, 20, 255,
                30, 30, 30, 255, 40, 40, 40, 255);
        WatermarkCompositor.composite(base, wm, 1.0, new Placement(-1, -1, 2, 2));
        assertEquals(40, base.sample(0, 0, PixelBuffer.RED));
        for (int i = 4; i < base.length(); i += 4)
            assertEquals(100, base.sample(i));

        PixelBuffer far = grey(3, 3);
        WatermarkCompositor.composite(far, wm, 1.0, new Placement(10, 10, 2, 2));
        assertArrayEquals(grey(3, 3).toByteArray(), far.toByteArray());
    }

    @Test
    @Timeout(5)
    void hugeScaleOnlyVisitsTheVisibleCorner() {
        PixelBuffer wm = grey(100, 100);
        wm.setSample(0, 0, PixelBuffer.RED, 250);
        PixelBuffer base = PixelBuffer.allocate(100, 100);

        WatermarkCompositor.composite(base, new Overlay(wm, 0, 0, 1e6), 1.0);
        for (int i = 0; i < base.length(); i += 4)
            assertEquals(0xFA6464FF, base.pixel(i), "pixel " + i / 4);

        Placement saturated = Placement.scaled(-5, -5, 1e12, wm);
        assertEquals(Integer.MAX_VALUE, saturated.width());
        WatermarkCompositor.composite(base, wm, 1.0, saturated);
        WatermarkCompositor.composite(base, wm, 1.0,
                new Placement(Integer.MIN_VALUE, Integer.MAX_VALUE, Integer.MAX_VALUE, Integer.MAX_VALUE));
        assertEquals(0xFA6464FF, base.pixel(0));
    }

    @Test
    void zeroOpacityIsNoOp() {
        PixelBuffer base = grey(2, 2);
        WatermarkCompositor.composite(base, TestBuffers.of(1, 1, 0, 0, 0, 255), 0.0, new Placement(0, 0, 2, 2));
        assertArrayEquals(grey(2, 2).toByteArray(), base.toByteArray());
    }

    @Test
    void validation() {
        PixelBuffer base = grey(2, 2);
        PixelBuffer wm = grey(1, 1);
        assertThrows(InvalidInputException.class,
                () -> WatermarkCompositor.composite(base, wm, 1.01, new Placement(0, 0, 1, 1)));
        assertThrows(InvalidInputException.class,
                () -> WatermarkCompositor.composite(base, wm, Double.NaN, new Placement(0, 0, 1, 1)));
        assertThrows(InvalidInputException.class, () -> new Placement(0, 0, 0, 1));
        assertThrows(InvalidInputException.class, () -> Placement.scaled(0, 0, 0, wm));
        assertThrows(InvalidInputException.class, () -> new Overlay(null, 0, 0, 1));
    }

    @Test
    void tinyScaleStillCoversOnePixel() {
        Placement p = Placement.scaled(5, 6, 0.001, grey(10, 3));
        assertEquals(new Placement(5, 6, 1, 1), p);
        assertEquals(new Placement(0, 0, 15, 5), Placement.scaled(0, 0, 1.5, grey(10, 3)));
    }
}
