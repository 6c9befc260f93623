package com.coach.linkage.importer;

import java.util.List;

/**
 * Result of committing an import preview.
 *
 * @param imported   coaches inserted
 * @param duplicates rows skipped because the coach already existed or repeated an earlier row
 * @param errors     rows rejected by validation
 * @param message    operator-facing summary
 */
public record ImportResult(
        int imported,
        int duplicates,
        List<ImportError> errors,
        String message
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public int rejected() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that could not be imported.
     *
     * @param rowNumber spreadsheet line number
     * @param coachName name as read from the row
     * @param message   the reason
     */
    public record ImportError(int rowNumber, String coachName, String message) {}

    @Override
    public String toString() {
        return "ImportResult{imported=" + imported +
                ", duplicates=" + duplicates +
                ", rejected=" + errors.size() + '}';
    }
}
