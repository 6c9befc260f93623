package com.coach.linkage.importer;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Splits a full name on whitespace: the first token is the first name, the remaining
 * tokens joined by single spaces are the last name.
 */
public final class FullNameParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private FullNameParser() {
    }

    public static ParsedName parse(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            return new ParsedName("", "");
        }
        String[] parts = WHITESPACE.split(fullName.trim());
        if (parts.length == 1) {
            return new ParsedName(parts[0], "");
        }
        return new ParsedName(parts[0], String.join(" ", Arrays.copyOfRange(parts, 1, parts.length)));
    }

    public record ParsedName(String firstName, String lastName) {}
}
