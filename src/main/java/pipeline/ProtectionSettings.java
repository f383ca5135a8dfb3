package pipeline;

import util.InvalidInputException;
import util.PixelBuffer;
import watermark.Overlay;
import watermark.TextWatermark;
import watermark.WatermarkCompositor;

/**
 * Everything needed to turn an original image into its protected output:
 * noise mode, strength and seed, plus the optional image and text watermarks
 * that are burned in afterwards (both at {@code opacity}).
 */
public record ProtectionSettings(ProtectionMode mode, int strength, long seed, Overlay overlay, String text,
        double opacity) {

    public static final int DEFAULT_STRENGTH = 25;
    public static final double DEFAULT_OPACITY = 0.2;

    public ProtectionSettings {
        if (mode == null)
            throw new InvalidInputException("mode is null");
        ProtectionPipeline.checkStrength(strength);
        WatermarkCompositor.checkOpacity(opacity);
    }

    public static ProtectionSettings of(ProtectionMode mode, int strength, long seed) {
        return new ProtectionSettings(mode, strength, seed, null, null, DEFAULT_OPACITY);
    }

    /** Protects a copy of {@code original}; the original is left untouched. */
    public PixelBuffer applyTo(PixelBuffer original) {
        PixelBuffer out = ProtectionPipeline.protect(original.copy(), mode, strength, seed);
        if (overlay != null)
            WatermarkCompositor.composite(out, overlay, opacity);
        if (text != null && !text.isEmpty())
            TextWatermark.apply(out, text, opacity);
        return out;
    }

    public ProtectionSettings withMode(ProtectionMode m) {
        return new ProtectionSettings(m, strength, seed, overlay, text, opacity);
    }

    public ProtectionSettings withStrength(int s) {
        return new ProtectionSettings(mode, s, seed, overlay, text, opacity);
    }

    public ProtectionSettings withSeed(long s) {
        return new ProtectionSettings(mode, strength, s, overlay, text, opacity);
    }

    public ProtectionSettings withOverlay(Overlay o) {
        return new ProtectionSettings(mode, strength, seed, o, text, opacity);
    }

    public ProtectionSettings withText(String t) {
        return new ProtectionSettings(mode, strength, seed, overlay, t, opacity);
    }

    public ProtectionSettings withOpacity(double o) {
        return new ProtectionSettings(mode, strength, seed, overlay, text, o);
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("mode=").append(mode.label())
                .append(" strength=").append(strength)
                .append(" seed=").append(seed)
                .append(" opacity=").append(opacity);
        if (overlay != null)
            sb.append(" watermark=").append(overlay.image().width()).append('x').append(overlay.image().height())
                    .append("@").append(overlay.x()).append(',').append(overlay.y())
                    .append(" scale=").append(overlay.scale());
        if (text != null && !text.isEmpty())
            sb.append(" text=\"").append(text).append('"');
        return sb.toString();
    }
}
