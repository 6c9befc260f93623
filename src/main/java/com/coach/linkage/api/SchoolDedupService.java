package com.coach.linkage.api;

import com.coach.linkage.candidate.SchoolCandidateGenerator;
import com.coach.linkage.core.model.School;
import com.coach.linkage.merge.SchoolMergeEngine;
import com.coach.linkage.metrics.MetricsService;
import com.coach.linkage.store.CoachRepository;
import com.coach.linkage.store.SchoolRepository;
import com.coach.linkage.suppression.SuppressionStore;

import java.util.List;
import java.util.Map;

/**
 * Duplicate schools across the registry. Dependent counts are coaches per school.
 */
public class SchoolDedupService extends DedupService<School> {

    private final SchoolRepository schoolRepository;
    private final CoachRepository coachRepository;

    public SchoolDedupService(SchoolRepository schoolRepository, CoachRepository coachRepository,
                              SchoolCandidateGenerator candidateGenerator, SchoolMergeEngine mergeEngine,
                              SuppressionStore suppressionStore, MetricsService metricsService) {
        super(SchoolMergeEngine.RECORD_KIND, candidateGenerator, mergeEngine, suppressionStore, metricsService);
        this.schoolRepository = schoolRepository;
        this.coachRepository = coachRepository;
    }

    @Override
    protected List<School> loadRecords() {
        return schoolRepository.findAll();
    }

    @Override
    protected Map<String, Integer> loadDependentCounts() {
        return coachRepository.countBySchool();
    }
}
