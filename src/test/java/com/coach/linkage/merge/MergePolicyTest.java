package com.coach.linkage.merge;

import com.coach.linkage.api.DedupOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class MergePolicyTest {

    @ParameterizedTest
    @DisplayName("Default policy should prefer the loser's name only over an initial")
    @CsvSource({
            "J.,John,true",
            "J,John,true",
            "Al,Albert,true",
            "Tom,Thomas,false",
            "J.,K,false",
            "John,J.,false"
    })
    void testDefaultPolicy(String keeperFirst, String loserFirst, boolean expected) {
        assertEquals(expected, MergePolicy.defaults().prefersLoserFirstName(keeperFirst, loserFirst));
    }

    @Test
    @DisplayName("Empty keeper first name should take any loser first name")
    void testEmptyKeeperName() {
        assertTrue(MergePolicy.defaults().prefersLoserFirstName(null, "Ann"));
        assertFalse(MergePolicy.defaults().prefersLoserFirstName(null, "  "));
    }

    @Test
    @DisplayName("Policy should follow the configured initial length")
    void testFromOptions() {
        MergePolicy policy = MergePolicy.from(DedupOptions.builder().initialNameMaxLength(3).build());

        assertEquals(3, policy.initialNameMaxLength());
        assertTrue(policy.prefersLoserFirstName("Tom", "Thomas"));
        assertThrows(IllegalArgumentException.class, () -> new MergePolicy(-1));
    }
}
