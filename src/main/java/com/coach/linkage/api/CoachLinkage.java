package com.coach.linkage.api;

import com.coach.linkage.candidate.CoachCandidateGenerator;
import com.coach.linkage.candidate.SchoolCandidateGenerator;
import com.coach.linkage.importer.ColumnMapping;
import com.coach.linkage.importer.CoachImporter;
import com.coach.linkage.importer.ImportPreview;
import com.coach.linkage.importer.ImportPreviewBuilder;
import com.coach.linkage.importer.ImportResult;
import com.coach.linkage.importer.MatchTier;
import com.coach.linkage.importer.OrganizationMatcher;
import com.coach.linkage.importer.SpreadsheetRows;
import com.coach.linkage.merge.CoachMergeEngine;
import com.coach.linkage.merge.MergeListener;
import com.coach.linkage.merge.MergePolicy;
import com.coach.linkage.merge.SchoolMergeEngine;
import com.coach.linkage.metrics.MetricsService;
import com.coach.linkage.metrics.NoOpMetricsService;
import com.coach.linkage.names.NameVariantResolver;
import com.coach.linkage.names.NicknameTable;
import com.coach.linkage.rules.SchoolNameRules;
import com.coach.linkage.similarity.LevenshteinDistance;
import com.coach.linkage.similarity.NameMatchScorer;
import com.coach.linkage.store.AttendanceRepository;
import com.coach.linkage.store.CoachRepository;
import com.coach.linkage.store.RecordStore;
import com.coach.linkage.store.SchoolRepository;
import com.coach.linkage.suppression.InMemoryKeyValueStore;
import com.coach.linkage.suppression.KeyValueStore;
import com.coach.linkage.suppression.KeyValueSuppressionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point: wires the dedup services and the coach importer over one record store.
 *
 * <pre>
 * CoachLinkage linkage = CoachLinkage.builder()
 *     .recordStore(store)
 *     .keyValueStore(new FileKeyValueStore(path))
 *     .build();
 *
 * DuplicateScan&lt;Coach&gt; scan = linkage.coaches().scan();
 * CandidatePair&lt;Coach&gt; top = scan.candidates().get(0);
 * MergeResult&lt;Coach&gt; result = linkage.coaches().merge(top.first().getId(), top.second().getId());
 *
 * ImportPreview preview = linkage.previewImport(rows, ColumnMapping.detect(rows.headers()));
 * ImportResult imported = linkage.commitImport(preview);
 * </pre>
 */
public class CoachLinkage {
    private static final Logger log = LoggerFactory.getLogger(CoachLinkage.class);

    private final CoachDedupService coaches;
    private final SchoolDedupService schools;
    private final SchoolRepository schoolRepository;
    private final CoachImporter coachImporter;
    private final MetricsService metricsService;
    private final DedupOptions options;

    private CoachLinkage(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null ? builder.metricsService : NoOpMetricsService.INSTANCE;

        CoachRepository coachRepository = new CoachRepository(builder.recordStore);
        AttendanceRepository attendanceRepository = new AttendanceRepository(builder.recordStore);
        this.schoolRepository = new SchoolRepository(builder.recordStore);

        KeyValueStore keyValueStore = builder.keyValueStore != null
                ? builder.keyValueStore : new InMemoryKeyValueStore();
        KeyValueSuppressionStore coachSuppression =
                new KeyValueSuppressionStore(keyValueStore, options.getCoachSuppressionKey());
        KeyValueSuppressionStore schoolSuppression =
                new KeyValueSuppressionStore(keyValueStore, options.getSchoolSuppressionKey());

        LevenshteinDistance levenshtein = new LevenshteinDistance(options.getMaxInputLength());
        CoachCandidateGenerator coachGenerator = new CoachCandidateGenerator(coachSuppression,
                new NameVariantResolver(levenshtein, NicknameTable.defaultTable(), options),
                new NameMatchScorer(levenshtein));
        SchoolCandidateGenerator schoolGenerator = new SchoolCandidateGenerator(schoolSuppression,
                SchoolNameRules.createEngine(), levenshtein, options);

        CoachMergeEngine coachMergeEngine = new CoachMergeEngine(coachRepository, attendanceRepository,
                MergePolicy.from(options), metricsService);
        SchoolMergeEngine schoolMergeEngine = new SchoolMergeEngine(schoolRepository, coachRepository, metricsService);
        for (MergeListener listener : builder.mergeListeners) {
            coachMergeEngine.addMergeListener(listener);
            schoolMergeEngine.addMergeListener(listener);
        }

        this.coaches = new CoachDedupService(coachRepository, attendanceRepository, coachGenerator,
                coachMergeEngine, coachSuppression, metricsService);
        this.schools = new SchoolDedupService(schoolRepository, coachRepository, schoolGenerator,
                schoolMergeEngine, schoolSuppression, metricsService);
        this.coachImporter = new CoachImporter(coachRepository, metricsService);

        log.info("CoachLinkage initialized: mergeListeners={}", builder.mergeListeners.size());
    }

    public CoachDedupService coaches() {
        return coaches;
    }

    public SchoolDedupService schools() {
        return schools;
    }

    /**
     * Matches spreadsheet rows against the current school registry.
     *
     * @throws com.coach.linkage.error.ValidationException if the mapping does not fit the spreadsheet
     */
    public ImportPreview previewImport(SpreadsheetRows rows, ColumnMapping mapping) {
        OrganizationMatcher matcher = new OrganizationMatcher(schoolRepository.findAll(),
                MatchTier.defaults(), options);
        return new ImportPreviewBuilder(matcher, metricsService).build(rows, mapping);
    }

    /**
     * Inserts the selected rows of a preview as new coaches.
     */
    public ImportResult commitImport(ImportPreview preview) {
        return coachImporter.commit(preview);
    }

    public DedupOptions getOptions() {
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RecordStore recordStore;
        private KeyValueStore keyValueStore;
        private DedupOptions options = DedupOptions.defaults();
        private MetricsService metricsService;
        private final List<MergeListener> mergeListeners = new ArrayList<>();

        public Builder recordStore(RecordStore recordStore) {
            this.recordStore = recordStore;
            return this;
        }

        /**
         * Persistence for dismissed pairs. Defaults to an in-memory store that does not
         * survive the process.
         */
        public Builder keyValueStore(KeyValueStore keyValueStore) {
            this.keyValueStore = keyValueStore;
            return this;
        }

        public Builder options(DedupOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder mergeListener(MergeListener listener) {
            this.mergeListeners.add(listener);
            return this;
        }

        public CoachLinkage build() {
            Objects.requireNonNull(recordStore, "recordStore is required");
            Objects.requireNonNull(options, "options is required");
            return new CoachLinkage(this);
        }
    }
}
