package com.coach.linkage.suppression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PairKeyTest {

    @Test
    @DisplayName("Key should not depend on argument order")
    void testOrderIndependent() {
        assertEquals(PairKey.of("b", "a"), PairKey.of("a", "b"));
        assertEquals("a|b", PairKey.of("b", "a").value());
    }

    @Test
    @DisplayName("Separator should keep hyphenated ids unambiguous")
    void testHyphenatedIds() {
        PairKey key = PairKey.of("1f0e-22", "0a9c-11");
        assertEquals("0a9c-11|1f0e-22", key.value());
        assertNotEquals(PairKey.of("0a9c", "11-1f0e-22").value(), key.value());
    }

    @Test
    @DisplayName("Constructor should reject unsorted or missing ids")
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new PairKey("z", "a"));
        assertThrows(NullPointerException.class, () -> PairKey.of(null, "a"));
    }
}
