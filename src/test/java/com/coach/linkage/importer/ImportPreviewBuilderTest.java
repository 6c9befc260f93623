package com.coach.linkage.importer;

import com.coach.linkage.core.model.ConfidenceTier;
import com.coach.linkage.core.model.School;
import com.coach.linkage.error.ValidationException;
import com.coach.linkage.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImportPreviewBuilderTest {

    @Mock
    private MetricsService metricsService;

    private ImportPreviewBuilder builder;

    @BeforeEach
    void setUp() {
        OrganizationMatcher matcher = new OrganizationMatcher(List.of(
                School.builder().id("osu").name("Ohio State University").build(),
                School.builder().id("duke").name("Duke University").build()));
        builder = new ImportPreviewBuilder(matcher, metricsService);
    }

    @Test
    @DisplayName("Should build rows from separate name columns")
    void testSeparateNames() {
        SpreadsheetRows sheet = new SpreadsheetRows(
                List.of("School", "First Name", "Last Name", "Email", "Phone"),
                List.of(
                        List.of("OSU", "Ryan", "Day", "day@osu.edu", "(614) 555-0100"),
                        List.of("Nowhere Tech", "Pat", "Doe", "", "")));

        ImportPreview preview = builder.build(sheet,
                ColumnMapping.separateNames("School", "First Name", "Last Name")
                        .withContactColumns("Email", "Phone", null));

        ImportRow first = preview.row(0);
        assertEquals("Ryan", first.getFirstName());
        assertEquals("osu", first.getMatchedSchool().getId());
        assertEquals(ConfidenceTier.EXACT, first.getTier());
        assertTrue(first.isInclude());
        assertEquals("day@osu.edu", first.getEmail());
        assertEquals("(614) 555-0100", first.getPhone());
        assertEquals(2, first.getRowNumber());

        ImportRow second = preview.row(1);
        assertFalse(second.isMatched());
        assertEquals(ConfidenceTier.NONE, second.getTier());
        assertFalse(second.isInclude());

        verify(metricsService).incrementImportMatch(ConfidenceTier.EXACT);
        verify(metricsService).incrementImportMatch(ConfidenceTier.NONE);
    }

    @Test
    @DisplayName("Should split a full-name column")
    void testFullName() {
        SpreadsheetRows sheet = new SpreadsheetRows(
                List.of("College", "Coach"),
                List.of(List.of("Duke University", "Jon  Paul   Jones")));

        ImportPreview preview = builder.build(sheet, ColumnMapping.detect(sheet.headers()));

        assertEquals("Jon", preview.row(0).getFirstName());
        assertEquals("Paul Jones", preview.row(0).getLastName());
    }

    @Test
    @DisplayName("Should collapse repeated rows and skip rows without school or name")
    void testSkipsAndDuplicates() {
        SpreadsheetRows sheet = new SpreadsheetRows(
                List.of("School", "First", "Last"),
                List.of(
                        List.of("OSU", "Ryan", "Day"),
                        List.of("osu", "RYAN", "day"),
                        List.of("", "No", "School"),
                        List.of("OSU", "", ""),
                        List.of("Duke University", "Ryan", "Day")));

        ImportPreview preview = builder.build(sheet, ColumnMapping.separateNames("School", "First", "Last"));

        assertEquals(2, preview.getRows().size());
        assertEquals(6, preview.row(1).getRowNumber());
    }

    @Test
    @DisplayName("Invalid contact values should be dropped with a warning")
    void testInvalidContacts() {
        SpreadsheetRows sheet = new SpreadsheetRows(
                List.of("School", "First", "Last", "Email", "Phone"),
                List.of(List.of("OSU", "Ryan", "Day", "not-an-email", "12345")));

        ImportRow row = builder.build(sheet, ColumnMapping.separateNames("School", "First", "Last")
                .withContactColumns("Email", "Phone", null)).row(0);

        assertNull(row.getEmail());
        assertNull(row.getPhone());
        assertEquals(2, row.getWarnings().size());
    }

    @Test
    @DisplayName("Mapping to a missing column should be rejected")
    void testMissingColumn() {
        SpreadsheetRows sheet = new SpreadsheetRows(List.of("School", "Name"), List.of(List.of("OSU", "Ryan Day")));

        assertThrows(ValidationException.class,
                () -> builder.build(sheet, ColumnMapping.separateNames("School", "First", "Last")));
        verifyNoInteractions(metricsService);
    }

    @Test
    @DisplayName("Row numbers should count blank lines of the sheet")
    void testRowNumbersAfterBlankLines() {
        SpreadsheetRows sheet = new SpreadsheetRows(
                List.of("School", "First", "Last"),
                List.of(
                        List.of("", "", ""),
                        List.of("OSU", "Ryan", "Day"),
                        List.of(" ", "", ""),
                        List.of("Duke University", "Jon", "Scheyer")));

        ImportPreview preview = builder.build(sheet, ColumnMapping.separateNames("School", "First", "Last"));

        assertEquals(2, preview.getRows().size());
        assertEquals(3, preview.row(0).getRowNumber());
        assertEquals(5, preview.row(1).getRowNumber());
        assertEquals(2, sheet.size());
    }
}
