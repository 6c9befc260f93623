package com.coach.linkage.importer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FullNameParserTest {

    @Test
    @DisplayName("First token is the first name, the rest the last name")
    void testSplit() {
        assertEquals(new FullNameParser.ParsedName("Mary", "Beth Van Dyke"), FullNameParser.parse(" Mary Beth  Van Dyke "));
    }

    @Test
    @DisplayName("Single token should be a first name only")
    void testSingleToken() {
        assertEquals(new FullNameParser.ParsedName("Cher", ""), FullNameParser.parse("Cher"));
    }

    @Test
    @DisplayName("Missing name should parse to empty parts")
    void testMissing() {
        assertEquals(new FullNameParser.ParsedName("", ""), FullNameParser.parse(null));
        assertEquals(new FullNameParser.ParsedName("", ""), FullNameParser.parse("   "));
    }
}
