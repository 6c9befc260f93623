package com.coach.linkage.importer;

import com.coach.linkage.error.ValidationException;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Which spreadsheet columns hold the school, the coach name and the optional contact
 * fields. Names come either from separate first/last columns or from one full-name column.
 */
public record ColumnMapping(
        String schoolColumn,
        String firstNameColumn,
        String lastNameColumn,
        String fullNameColumn,
        String emailColumn,
        String phoneColumn,
        String titleColumn
) {

    public static ColumnMapping separateNames(String schoolColumn, String firstNameColumn, String lastNameColumn) {
        return new ColumnMapping(schoolColumn, firstNameColumn, lastNameColumn, null, null, null, null);
    }

    public static ColumnMapping fullName(String schoolColumn, String fullNameColumn) {
        return new ColumnMapping(schoolColumn, null, null, fullNameColumn, null, null, null);
    }

    public ColumnMapping withContactColumns(String emailColumn, String phoneColumn, String titleColumn) {
        return new ColumnMapping(schoolColumn, firstNameColumn, lastNameColumn, fullNameColumn,
                emailColumn, phoneColumn, titleColumn);
    }

    public boolean usesFullName() {
        return fullNameColumn != null && (firstNameColumn == null || lastNameColumn == null);
    }

    /**
     * Guesses the mapping from header names. Separate first/last columns are preferred over
     * a full-name column when both are present.
     */
    public static ColumnMapping detect(List<String> headers) {
        String school = find(headers, h -> h.contains("school") || h.contains("college") || h.contains("university"));
        String first = find(headers, h -> h.contains("first") && h.contains("name"));
        String last = find(headers, h -> h.contains("last") && h.contains("name"));
        String full = find(headers, h -> (h.contains("coach") || h.contains("name"))
                && !h.contains("first") && !h.contains("last"));
        String email = find(headers, h -> h.contains("email") || h.contains("e-mail"));
        String phone = find(headers, h -> h.contains("phone") || h.contains("cell"));
        String title = find(headers, h -> h.contains("title") || h.contains("position"));

        if (first != null && last != null) {
            full = null;
        }
        return new ColumnMapping(school, first, last, full, email, phone, title);
    }

    /**
     * @throws ValidationException if a required column is unset or missing from {@code rows}
     */
    public void validate(SpreadsheetRows rows) {
        requireColumn(rows, schoolColumn, "school");
        if (usesFullName()) {
            requireColumn(rows, fullNameColumn, "full name");
        } else {
            requireColumn(rows, firstNameColumn, "first name");
            requireColumn(rows, lastNameColumn, "last name");
        }
        for (String optional : new String[] {emailColumn, phoneColumn, titleColumn}) {
            if (optional != null && rows.indexOf(optional) < 0) {
                throw new ValidationException("Column '" + optional + "' not found in spreadsheet");
            }
        }
    }

    private static void requireColumn(SpreadsheetRows rows, String column, String label) {
        if (column == null || column.isBlank()) {
            throw new ValidationException("A " + label + " column must be selected");
        }
        if (rows.indexOf(column) < 0) {
            throw new ValidationException("Column '" + column + "' not found in spreadsheet");
        }
    }

    private static String find(List<String> headers, Predicate<String> test) {
        for (String header : headers) {
            if (header != null && test.test(header.trim().toLowerCase(Locale.ROOT))) {
                return header.trim();
            }
        }
        return null;
    }
}
