package pipeline;

import java.util.Locale;
import java.util.regex.Pattern;

import util.InvalidInputException;

/** Protection presets, ordered from lightest to heaviest. */
public enum ProtectionMode {
    SOFT(0, "soft"),
    BALANCED(1, "balanced"),
    STRONG(2, "strong"),
    AI_POISON(3, "aipoison");

    private static final Pattern SIGNED_NUMBER = Pattern.compile("[+-]?\\d+");

    private final int index;
    private final String label;

    ProtectionMode(int index, String label) {
        this.index = index;
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ProtectionMode fromIndex(int index) {
        for (ProtectionMode m : values())
            if (m.index == index)
                return m;
        throw new InvalidInputException("mode index must be 0..3, got " + index);
    }

    /**
     * Accepts an index ("2") or a name in any case, with or without
     * separators ("AIPoison", "ai_poison", "ai-poison").
     */
    public static ProtectionMode parse(String text) {
        if (text == null || text.isBlank())
            throw new InvalidInputException("mode is empty");
        String trimmed = text.trim();
        if (SIGNED_NUMBER.matcher(trimmed).matches()) {
            try {
                return fromIndex(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                throw new InvalidInputException("mode index must be 0..3, got " + trimmed);
            }
        }
        String t = trimmed.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        for (ProtectionMode m : values())
            if (m.label.equals(t))
                return m;
        throw new InvalidInputException("unknown mode '" + text + "' (soft | balanced | strong | aipoison)");
    }
}
