package com.coach.linkage.importer;

import com.coach.linkage.core.model.ConfidenceTier;
import com.coach.linkage.logging.LogContext;
import com.coach.linkage.metrics.MetricsService;
import com.coach.linkage.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns spreadsheet rows into an {@link ImportPreview}.
 *
 * <p>Rows without school text or without any name are skipped. A row repeating the
 * school text and name of an earlier row (case-insensitive) is dropped. Invalid email or
 * phone values are left out of the row and reported as row warnings. Each remaining row
 * is matched through the {@link OrganizationMatcher}; matched rows start included.</p>
 */
public class ImportPreviewBuilder {
    private static final Logger log = LoggerFactory.getLogger(ImportPreviewBuilder.class);

    private final OrganizationMatcher matcher;
    private final MetricsService metricsService;

    public ImportPreviewBuilder(OrganizationMatcher matcher) {
        this(matcher, null);
    }

    public ImportPreviewBuilder(OrganizationMatcher matcher, MetricsService metricsService) {
        this.matcher = matcher;
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
    }

    /**
     * @throws com.coach.linkage.error.ValidationException if the mapping does not fit the spreadsheet
     */
    public ImportPreview build(SpreadsheetRows sheet, ColumnMapping mapping) {
        mapping.validate(sheet);
        String batchId = LogContext.generateCorrelationId();

        try (LogContext logCtx = LogContext.forImport(batchId)) {
            List<ImportRow> rows = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            int skipped = 0;

            for (int index = 0; index < sheet.rows().size(); index++) {
                List<String> cells = sheet.rows().get(index);
                if (SpreadsheetRows.isBlank(cells)) {
                    continue;
                }
                int lineNumber = SpreadsheetRows.lineNumber(index);
                String schoolText = sheet.cell(cells, mapping.schoolColumn());
                if (schoolText.isEmpty()) {
                    skipped++;
                    continue;
                }

                String firstName;
                String lastName;
                if (mapping.usesFullName()) {
                    FullNameParser.ParsedName parsed = FullNameParser.parse(sheet.cell(cells, mapping.fullNameColumn()));
                    firstName = parsed.firstName();
                    lastName = parsed.lastName();
                } else {
                    firstName = sheet.cell(cells, mapping.firstNameColumn());
                    lastName = sheet.cell(cells, mapping.lastNameColumn());
                }
                if (firstName.isEmpty() && lastName.isEmpty()) {
                    skipped++;
                    continue;
                }

                String key = (schoolText + "|" + firstName + "|" + lastName).toLowerCase(Locale.ROOT);
                if (!seen.add(key)) {
                    log.debug("import.duplicate-row line={} key='{}'", lineNumber, key);
                    continue;
                }

                List<String> warnings = new ArrayList<>();
                String emailText = sheet.cell(cells, mapping.emailColumn());
                String email = contact(emailText, ContactValidator.isValidEmail(emailText), "email", warnings);
                String phoneText = sheet.cell(cells, mapping.phoneColumn());
                String phone = contact(phoneText, ContactValidator.isValidPhone(phoneText), "phone", warnings);
                String title = emptyToNull(sheet.cell(cells, mapping.titleColumn()));

                ImportRow row = new ImportRow(lineNumber, schoolText, firstName, lastName, email, phone, title, warnings);
                Optional<SchoolMatch> match = matcher.resolve(schoolText);
                match.ifPresent(row::applyMatch);
                metricsService.incrementImportMatch(match.map(SchoolMatch::tier).orElse(ConfidenceTier.NONE));
                rows.add(row);
            }

            ImportPreview preview = new ImportPreview(batchId, rows);
            log.info("import.preview batchId={} rows={} skipped={} stats={}",
                    batchId, rows.size(), skipped, preview.stats());
            return preview;
        }
    }

    private static String contact(String value, boolean valid, String field, List<String> warnings) {
        if (value.isEmpty()) {
            return null;
        }
        if (!valid) {
            warnings.add("Invalid " + field + " '" + value + "' ignored");
            return null;
        }
        return value;
    }

    private static String emptyToNull(String value) {
        return value.isEmpty() ? null : value;
    }
}
