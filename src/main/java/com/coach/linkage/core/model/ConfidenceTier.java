package com.coach.linkage.core.model;

/**
 * How strongly a free-text school name was matched against the registry.
 * Declared from strongest to weakest automatic tier; {@code MANUAL} marks an operator choice.
 */
public enum ConfidenceTier {
    EXACT,
    HIGH,
    MEDIUM,
    LOW,
    MANUAL,
    NONE;

    public boolean isMatched() {
        return this != NONE;
    }
}
