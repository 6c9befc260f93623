package com.coach.linkage.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LevenshteinDistanceTest {

    private final LevenshteinDistance levenshtein = new LevenshteinDistance();

    @ParameterizedTest
    @DisplayName("Should compute edit distance")
    @CsvSource({
            "kitten,sitting,3",
            "john,jon,1",
            "john,jane,3",
            "smith,smyth,1",
            "smith,smith,0",
            "abc,'',3",
            "'',xyz,3"
    })
    void testDistance(String a, String b, int expected) {
        assertEquals(expected, levenshtein.distance(a, b));
    }

    @Test
    @DisplayName("Should ignore case and surrounding whitespace")
    void testCaseAndWhitespaceInsensitive() {
        assertEquals(0, levenshtein.distance("  John ", "JOHN"));
        assertEquals(1.0, levenshtein.similarity("Ohio State", " ohio state "));
    }

    @Test
    @DisplayName("Should treat null as empty")
    void testNullAsEmpty() {
        assertEquals(0, levenshtein.distance(null, null));
        assertEquals(4, levenshtein.distance(null, "john"));
        assertEquals(1.0, levenshtein.similarity(null, ""));
    }

    @Test
    @DisplayName("Distance should be symmetric")
    void testSymmetry() {
        String[][] pairs = {{"mike", "michael"}, {"st marys", "saint marys"}, {"a", "ab"}};
        for (String[] pair : pairs) {
            assertEquals(levenshtein.distance(pair[0], pair[1]), levenshtein.distance(pair[1], pair[0]));
        }
    }

    @Test
    @DisplayName("Similarity should be one minus distance over the longer length")
    void testSimilarityRatio() {
        assertEquals(0.75, levenshtein.similarity("john", "jon"), 1e-9);
        assertEquals(0.0, levenshtein.similarity("abc", "xyz"), 1e-9);
    }

    @Test
    @DisplayName("Should truncate inputs beyond the configured length")
    void testMaxInputLength() {
        LevenshteinDistance capped = new LevenshteinDistance(4);
        assertEquals(0, capped.distance("abcdXXXX", "abcdYY"));
        assertEquals(4, capped.getMaxInputLength());
        assertThrows(IllegalArgumentException.class, () -> new LevenshteinDistance(0));
    }
}
