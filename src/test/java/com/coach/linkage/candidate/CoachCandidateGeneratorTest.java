package com.coach.linkage.candidate;

import com.coach.linkage.core.model.CandidatePair;
import com.coach.linkage.core.model.Coach;
import com.coach.linkage.core.model.MatchType;
import com.coach.linkage.suppression.InMemoryKeyValueStore;
import com.coach.linkage.suppression.KeyValueSuppressionStore;
import com.coach.linkage.suppression.SuppressionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CoachCandidateGeneratorTest {

    private SuppressionStore suppressionStore;
    private CoachCandidateGenerator generator;

    @BeforeEach
    void setUp() {
        suppressionStore = new KeyValueSuppressionStore(new InMemoryKeyValueStore(), "dismissedCoachPairs");
        generator = new CoachCandidateGenerator(suppressionStore);
    }

    private static Coach coach(String id, String first, String last, String schoolId) {
        return Coach.builder().id(id).firstName(first).lastName(last).schoolId(schoolId).build();
    }

    private static List<String> ids(List<CandidatePair<Coach>> pairs) {
        return pairs.stream().map(p -> p.first().getId() + "+" + p.second().getId()).toList();
    }

    private final List<Coach> roster = List.of(
            coach("c1", "J.", "Smith", "s1"),
            coach("c2", "John", "Smith", "s1"),
            coach("c3", "Jane", "Doe", "s1"),
            coach("c4", "John", "Doe", "s1"),
            coach("c5", "John", "Smith", "s2"),
            coach("c6", "John", "Smith", "s1"));

    @Test
    @DisplayName("Should rank pairs by score, ties in input order")
    void testRanking() {
        DuplicateScan<Coach> scan = generator.generate(roster, Map.of());

        assertEquals(List.of("c2+c6", "c1+c2", "c1+c6"), ids(scan.candidates()));
        assertEquals(MatchType.EXACT, scan.candidates().get(0).matchType());
        assertEquals(110, scan.candidates().get(0).score());
        assertEquals(MatchType.FUZZY, scan.candidates().get(1).matchType());
        assertEquals(60, scan.candidates().get(1).score());
        assertEquals(1, scan.exactCount());
        assertEquals(2, scan.fuzzyCount());
    }

    @Test
    @DisplayName("Should never pair coaches of different schools")
    void testNoCrossSchoolPairs() {
        DuplicateScan<Coach> scan = generator.generate(roster, Map.of());

        for (CandidatePair<Coach> pair : scan.candidates()) {
            assertEquals(pair.first().getSchoolId(), pair.second().getSchoolId());
        }
        assertTrue(scan.candidates().stream().noneMatch(p -> p.involves("c5", "c2")));
    }

    @Test
    @DisplayName("John Doe and Jane Doe should not be proposed")
    void testJohnJaneDoe() {
        DuplicateScan<Coach> scan = generator.generate(roster, Map.of());
        assertTrue(scan.candidates().stream().noneMatch(p -> p.involves("c3", "c4")));
    }

    @Test
    @DisplayName("Dismissed pairs should not reappear until cleared")
    void testSuppression() {
        suppressionStore.dismiss("c2", "c1");

        assertEquals(List.of("c2+c6", "c1+c6"), ids(generator.generate(roster, Map.of()).candidates()));

        suppressionStore.clearAll();
        assertEquals(3, generator.generate(roster, Map.of()).candidates().size());
    }

    @Test
    @DisplayName("Coaches missing a name should be skipped and listed")
    void testSkipsInvalid() {
        List<Coach> records = List.of(
                coach("c1", "John", "Smith", "s1"),
                coach("c2", " ", "Smith", "s1"),
                coach("c3", "John", "Smith", "s1"));

        DuplicateScan<Coach> scan = generator.generate(records, Map.of());

        assertEquals(List.of("c2"), scan.skippedIds());
        assertEquals(List.of("c1+c3"), ids(scan.candidates()));
        assertEquals(3, scan.totalRecords());
    }

    @Test
    @DisplayName("Coaches without a school should not be compared")
    void testNoSchool() {
        List<Coach> records = List.of(
                coach("c1", "John", "Smith", null),
                coach("c2", "John", "Smith", null));

        assertTrue(generator.generate(records, Map.of()).candidates().isEmpty());
    }

    @Test
    @DisplayName("Swapping the input order should find the same pairs")
    void testOrderIndependentPairs() {
        List<Coach> reversed = new ArrayList<>(roster);
        Collections.reverse(reversed);

        DuplicateScan<Coach> forward = generator.generate(roster, Map.of());
        DuplicateScan<Coach> backward = generator.generate(reversed, Map.of());

        assertEquals(forward.candidates().size(), backward.candidates().size());
        for (CandidatePair<Coach> pair : forward.candidates()) {
            assertTrue(backward.candidates().stream()
                    .anyMatch(p -> p.involves(pair.first().getId(), pair.second().getId())
                            && p.matchType() == pair.matchType() && p.score() == pair.score()));
        }
    }
}
