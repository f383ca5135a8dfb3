package pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import stages.FilterKind;
import util.InvalidInputException;
import util.PixelBuffer;
import util.TestBuffers;

class ProtectionPipelineTest {

    @Test
    void softGolden() {
        PixelBuffer buf = TestBuffers.of(2, 2,
                200, 100, 50, 255, 10, 20, 30, 255,
                0, 0, 0, 255, 128, 128, 128, 255);
        PixelBuffer out = ProtectionPipeline.protect(buf, ProtectionMode.SOFT, 10, 1);

        assertSame(buf, out);
        assertArrayEquals(new int[] {
                197, 96, 50, 255, 12, 19, 31, 255,
                1, 0, 2, 255, 133, 130, 135, 255 }, TestBuffers.samples(out));
    }

    @Test
    void aiPoisonGolden() {
        PixelBuffer buf = TestBuffers.gradient(4, 4);
        PixelBuffer before = buf.copy();
        ProtectionPipeline.protect(buf, ProtectionMode.AI_POISON, 20, 12345);

        assertArrayEquals(new int[] {
                190, 62, 105, 255, 119, 56, 102, 255, 57, 41, 98, 255, 177, 75, 111, 255,
                137, 40, 102, 255, 139, 49, 100, 255, 51, 42, 94, 255, 179, 76, 105, 255,
                195, 55, 96, 255, 0, 22, 94, 255, 61, 45, 92, 255, 180, 65, 101, 255,
                177, 73, 105, 255, 196, 60, 107, 255, 116, 55, 106, 255, 181, 62, 109, 255 },
                TestBuffers.samples(buf));
        for (int i = 0; i < buf.length(); i += 4)
            assertNotEquals(before.pixel(i), buf.pixel(i), "pixel " + i / 4 + " unchanged");
    }

    @Test
    void indexOverloadMatchesEnum() {
        PixelBuffer a = TestBuffers.noisy(20, 15, 3);
        PixelBuffer b = a.copy();
        ProtectionPipeline.protect(a, 2, 30, 77);
        ProtectionPipeline.protect(b, ProtectionMode.STRONG, 30, 77);
        assertArrayEquals(a.toByteArray(), b.toByteArray());
    }

    @ParameterizedTest
    @EnumSource(ProtectionMode.class)
    void sameInputsSameBytes(ProtectionMode mode) {
        PixelBuffer a = TestBuffers.noisy(33, 21, 11);
        PixelBuffer b = a.copy();
        ProtectionPipeline.protect(a, mode, 42, 987654321L);
        ProtectionPipeline.protect(b, mode, 42, 987654321L);
        assertArrayEquals(a.toByteArray(), b.toByteArray());
        assertEquals(33, a.width());
        assertEquals(21, a.height());
    }

    @Test
    void differentSeedsDiffer() {
        PixelBuffer a = TestBuffers.gradient(16, 16);
        PixelBuffer b = a.copy();
        ProtectionPipeline.protect(a, ProtectionMode.BALANCED, 25, 1);
        ProtectionPipeline.protect(b, ProtectionMode.BALANCED, 25, 2);
        assertFalse(a.sameContent(b));
    }

    @Test
    void stepTables() {
        assertEquals(List.of(
                FilterStep.of(FilterKind.BALANCED_NOISE, StrengthScale.divide(2)),
                FilterStep.of(FilterKind.COLOR_SHIFT, StrengthScale.divide(4))),
                ProtectionPipeline.steps(ProtectionMode.SOFT));
        assertEquals(List.of(
                FilterStep.of(FilterKind.BALANCED_NOISE, StrengthScale.full()),
                FilterStep.of(FilterKind.EDGE_JITTER, StrengthScale.divide(2)),
                FilterStep.of(FilterKind.ADVERSARIAL_NOISE, StrengthScale.divide(3))),
                ProtectionPipeline.steps(ProtectionMode.BALANCED));
        assertEquals(List.of(
                FilterKind.BALANCED_NOISE, FilterKind.EDGE_JITTER, FilterKind.TEXTURE_NOISE,
                FilterKind.COLOR_SHIFT, FilterKind.GEOMETRIC_DISTORTION),
                ProtectionPipeline.steps(ProtectionMode.STRONG).stream().map(FilterStep::filter).toList());
        assertEquals(List.of(
                FilterKind.SINE_INTERFERENCE, FilterKind.GEOMETRIC_DISTORTION, FilterKind.ADVERSARIAL_NOISE,
                FilterKind.COLOR_SHIFT, FilterKind.BLOCK_LOCAL_SCRAMBLE),
                ProtectionPipeline.steps(ProtectionMode.AI_POISON).stream().map(FilterStep::filter).toList());
    }

    @Test
    void derivedStrengths() {
        List<FilterStep> strong = ProtectionPipeline.steps(ProtectionMode.STRONG);
        assertEquals(List.of(37, 37, 18, 18, 7),
                strong.stream().map(s -> s.strengthFor(37)).toList());
        List<FilterStep> poison = ProtectionPipeline.steps(ProtectionMode.AI_POISON);
        assertEquals(List.of(25, 25, 40, 40, 25),
                poison.stream().map(s -> s.strengthFor(50)).toList());
    }

    @ParameterizedTest
    @ValueSource(ints = { -1, 51, Integer.MIN_VALUE })
    void rejectsStrengthOutsideRangeWithoutTouchingBuffer(int strength) {
        PixelBuffer buf = TestBuffers.gradient(5, 5);
        PixelBuffer before = buf.copy();
        assertThrows(InvalidInputException.class,
                () -> ProtectionPipeline.protect(buf, ProtectionMode.STRONG, strength, 1));
        assertArrayEquals(before.toByteArray(), buf.toByteArray());
    }

    @Test
    void rejectsBadModeAndMissingBuffer() {
        PixelBuffer buf = TestBuffers.gradient(5, 5);
        assertThrows(InvalidInputException.class, () -> ProtectionPipeline.protect(buf, 4, 10, 1));
        assertThrows(InvalidInputException.class, () -> ProtectionPipeline.protect(buf, -1, 10, 1));
        assertThrows(InvalidInputException.class,
                () -> ProtectionPipeline.protect(buf, (ProtectionMode) null, 10, 1));
        assertThrows(InvalidInputException.class,
                () -> ProtectionPipeline.protect(null, ProtectionMode.SOFT, 10, 1));
    }

    @Test
    void boundaryStrengthsAccepted() {
        ProtectionPipeline.protect(TestBuffers.gradient(6, 6), ProtectionMode.AI_POISON, 0, 5);
        ProtectionPipeline.protect(TestBuffers.gradient(6, 6), ProtectionMode.AI_POISON, 50, 5);
        ProtectionPipeline.protect(TestBuffers.gradient(1, 1), ProtectionMode.STRONG, 50, 5);
    }
}
