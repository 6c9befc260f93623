package com.coach.linkage.importer;

import com.coach.linkage.core.model.School;

import java.util.List;
import java.util.Objects;

/**
 * Reviewable result of matching a spreadsheet: one {@link ImportRow} per distinct coach.
 * An operator choice made through {@link #assignSchool} is final for the row and is
 * never re-matched.
 */
public class ImportPreview {

    private final String batchId;
    private final List<ImportRow> rows;

    public ImportPreview(String batchId, List<ImportRow> rows) {
        this.batchId = batchId;
        this.rows = List.copyOf(rows);
    }

    public String getBatchId() {
        return batchId;
    }

    public List<ImportRow> getRows() {
        return rows;
    }

    public ImportRow row(int index) {
        Objects.checkIndex(index, rows.size());
        return rows.get(index);
    }

    public void toggleInclude(int index) {
        ImportRow row = row(index);
        row.setInclude(!row.isInclude());
    }

    /**
     * Records the operator's school for a row with tier MANUAL and includes the row.
     */
    public void assignSchool(int index, School school) {
        if (school == null) {
            clearSchool(index);
            return;
        }
        row(index).assignManually(school);
    }

    /**
     * Removes the school of a row and excludes it from the import.
     */
    public void clearSchool(int index) {
        row(index).clearSchool();
    }

    /**
     * Rows that would be written by a commit: included and assigned to a school.
     */
    public List<ImportRow> selectedRows() {
        return rows.stream().filter(r -> r.isInclude() && r.isMatched()).toList();
    }

    public Stats stats() {
        int matched = (int) rows.stream().filter(ImportRow::isMatched).count();
        int selected = (int) rows.stream().filter(ImportRow::isInclude).count();
        return new Stats(rows.size(), matched, rows.size() - matched, selected);
    }

    /**
     * Preview counters.
     *
     * @param total     rows in the preview
     * @param matched   rows with a school
     * @param unmatched rows without a school
     * @param selected  rows marked for import
     */
    public record Stats(int total, int matched, int unmatched, int selected) {}
}
