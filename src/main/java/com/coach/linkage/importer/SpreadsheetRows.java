package com.coach.linkage.importer;

import java.util.List;

/**
 * Parsed spreadsheet contents: the header row and the data rows as string cells.
 * Data rows are kept in sheet order, blank ones included, so the position of a row
 * gives its line number in the sheet.
 *
 * @param headers column headers, trimmed
 * @param rows    data rows; a row may be shorter than the header row
 */
public record SpreadsheetRows(List<String> headers, List<List<String>> rows) {

    public SpreadsheetRows {
        headers = headers.stream().map(h -> h == null ? "" : h.trim()).toList();
        rows = rows.stream()
                .map(row -> row.stream().map(cell -> cell == null ? "" : cell).toList())
                .toList();
    }

    public int indexOf(String header) {
        return header == null ? -1 : headers.indexOf(header.trim());
    }

    /**
     * Trimmed cell of a data row, or an empty string when the column is absent or the
     * row is too short.
     */
    public String cell(List<String> row, String header) {
        int index = indexOf(header);
        if (index < 0 || index >= row.size()) {
            return "";
        }
        return row.get(index).trim();
    }

    /**
     * Sheet line number of the data row at {@code index}, counting the header as line 1.
     */
    public static int lineNumber(int index) {
        return index + 2;
    }

    public static boolean isBlank(List<String> row) {
        return row.stream().allMatch(String::isBlank);
    }

    /**
     * Number of data rows with at least one non-blank cell.
     */
    public int size() {
        return (int) rows.stream().filter(row -> !isBlank(row)).count();
    }
}
