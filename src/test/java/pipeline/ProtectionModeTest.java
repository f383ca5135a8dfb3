package pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import util.InvalidInputException;

class ProtectionModeTest {

    @Test
    void indicesAreStable() {
        assertEquals(ProtectionMode.SOFT, ProtectionMode.fromIndex(0));
        assertEquals(ProtectionMode.BALANCED, ProtectionMode.fromIndex(1));
        assertEquals(ProtectionMode.STRONG, ProtectionMode.fromIndex(2));
        assertEquals(ProtectionMode.AI_POISON, ProtectionMode.fromIndex(3));
        assertThrows(InvalidInputException.class, () -> ProtectionMode.fromIndex(4));
    }

    @ParameterizedTest
    @ValueSource(strings = { "aipoison", "AIPoison", "ai_poison", "ai-poison", " 3 " })
    void parsesPoisonSpellings(String text) {
        assertEquals(ProtectionMode.AI_POISON, ProtectionMode.parse(text));
    }

    @Test
    void signedIndicesAreNumbers() {
        assertEquals(ProtectionMode.STRONG, ProtectionMode.parse("+2"));
        assertEquals(ProtectionMode.SOFT, ProtectionMode.parse("-0"));
    }

    @Test
    void parsesNames() {
        assertEquals(ProtectionMode.SOFT, ProtectionMode.parse("Soft"));
        assertEquals(ProtectionMode.STRONG, ProtectionMode.parse("STRONG"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "  ", "medium", "7", "-1", "-0-", "+4", "99999999999", "1.5" })
    void rejectsUnknown(String text) {
        assertThrows(InvalidInputException.class, () -> ProtectionMode.parse(text));
    }
}
