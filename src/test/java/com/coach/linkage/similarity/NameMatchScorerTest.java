package com.coach.linkage.similarity;

import com.coach.linkage.core.model.Coach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NameMatchScorerTest {

    private final NameMatchScorer scorer = new NameMatchScorer();

    @ParameterizedTest
    @DisplayName("Should add points per matching feature")
    @CsvSource({
            // identical names: 50 + 50 + same initial
            "John,Smith,John,Smith,110",
            // first one edit apart: 30, last equal: 50, same initial: 10
            "John,Smith,Jon,Smith,90",
            // last one edit apart: 30, first equal: 50, same initial: 10
            "John,Smith,John,Smyth,90",
            // initial vs full name: last equal + same initial
            "J.,Smith,John,Smith,60",
            // nothing in common
            "Alice,Jones,Bob,Smith,0"
    })
    void testScore(String firstA, String lastA, String firstB, String lastB, int expected) {
        assertEquals(expected, scorer.score(firstA, lastA, firstB, lastB));
    }

    @Test
    @DisplayName("Score should be symmetric and case-insensitive")
    void testSymmetric() {
        assertEquals(scorer.score("Mike", "Brown", "michael", "BROWN"),
                scorer.score("michael", "BROWN", "Mike", "Brown"));
        assertEquals(110, scorer.score("JOHN", "smith", "john", "SMITH"));
    }

    @Test
    @DisplayName("Should score coaches by their names")
    void testScoreCoaches() {
        Coach a = Coach.builder().id("1").firstName("Bill").lastName("Jones").build();
        Coach b = Coach.builder().id("2").firstName("Will").lastName("Jones").build();
        assertEquals(NameMatchScorer.EXACT_NAME_POINTS + NameMatchScorer.ONE_EDIT_POINTS, scorer.score(a, b));
    }

    @Test
    @DisplayName("Missing first names compare as equal empty names")
    void testMissingNames() {
        assertEquals(2 * NameMatchScorer.EXACT_NAME_POINTS, scorer.score(null, "Smith", null, "Smith"));
    }
}
