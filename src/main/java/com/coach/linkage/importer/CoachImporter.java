package com.coach.linkage.importer;

import com.coach.linkage.core.model.Coach;
import com.coach.linkage.core.model.CoachValidator;
import com.coach.linkage.error.ValidationException;
import com.coach.linkage.logging.LogContext;
import com.coach.linkage.metrics.MetricsService;
import com.coach.linkage.metrics.NoOpMetricsService;
import com.coach.linkage.store.CoachRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Writes the selected rows of an {@link ImportPreview} as new coaches.
 *
 * <p>A row is skipped as a duplicate when a coach with the same school and the same first
 * and last name (case-insensitive) already exists, or when an earlier row of the same
 * commit produced it. Rows without a first or last name are rejected. The remaining
 * coaches are inserted in one batch.</p>
 */
public class CoachImporter {
    private static final Logger log = LoggerFactory.getLogger(CoachImporter.class);

    private final CoachRepository coachRepository;
    private final MetricsService metricsService;

    public CoachImporter(CoachRepository coachRepository) {
        this(coachRepository, null);
    }

    public CoachImporter(CoachRepository coachRepository, MetricsService metricsService) {
        this.coachRepository = coachRepository;
        this.metricsService = metricsService != null ? metricsService : NoOpMetricsService.INSTANCE;
    }

    /**
     * @throws ValidationException if no row is selected
     * @throws com.coach.linkage.error.StoreException if the batch insert fails
     */
    public ImportResult commit(ImportPreview preview) {
        List<ImportRow> selected = preview.selectedRows();
        if (selected.isEmpty()) {
            throw new ValidationException("No coaches selected for import");
        }

        try (LogContext logCtx = LogContext.forImport(preview.getBatchId())) {
            Set<String> existing = new HashSet<>();
            for (Coach coach : coachRepository.findAll()) {
                existing.add(key(coach.getSchoolId(), coach.getFirstName(), coach.getLastName()));
            }

            List<Coach> toInsert = new ArrayList<>();
            List<ImportResult.ImportError> errors = new ArrayList<>();
            int duplicates = 0;

            for (ImportRow row : selected) {
                Coach coach = Coach.builder()
                        .firstName(row.getFirstName())
                        .lastName(row.getLastName())
                        .email(row.getEmail())
                        .phone(row.getPhone())
                        .title(row.getTitle())
                        .schoolId(row.getMatchedSchool().getId())
                        .build();
                try {
                    CoachValidator.requireNames(coach);
                } catch (ValidationException e) {
                    errors.add(new ImportResult.ImportError(row.getRowNumber(), row.coachName(), e.getMessage()));
                    log.warn("import.rejected line={} name='{}' error={}", row.getRowNumber(), row.coachName(), e.getMessage());
                    continue;
                }
                if (!existing.add(key(coach.getSchoolId(), coach.getFirstName(), coach.getLastName()))) {
                    duplicates++;
                    continue;
                }
                toInsert.add(coach);
            }

            int imported = toInsert.isEmpty() ? 0 : coachRepository.insertAll(toInsert).size();
            ImportResult result = new ImportResult(imported, duplicates, errors, message(imported, duplicates, errors.size()));
            metricsService.recordImportCommit(imported, duplicates, errors.size());
            log.info("import.completed batchId={} result={}", preview.getBatchId(), result);
            return result;
        }
    }

    private static String message(int imported, int duplicates, int rejected) {
        if (imported == 0 && rejected == 0) {
            return "All coaches already exist in the database";
        }
        StringBuilder message = new StringBuilder("Successfully imported ")
                .append(imported).append(imported == 1 ? " coach" : " coaches");
        if (duplicates > 0) {
            message.append(", ").append(duplicates).append(" already existed");
        }
        if (rejected > 0) {
            message.append(", ").append(rejected).append(" rejected");
        }
        return message.toString();
    }

    private static String key(String schoolId, String firstName, String lastName) {
        return (schoolId + "|" + trim(firstName) + "|" + trim(lastName)).toLowerCase(Locale.ROOT);
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
