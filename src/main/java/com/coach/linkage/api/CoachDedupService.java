package com.coach.linkage.api;

import com.coach.linkage.candidate.CoachCandidateGenerator;
import com.coach.linkage.core.model.Coach;
import com.coach.linkage.merge.CoachMergeEngine;
import com.coach.linkage.metrics.MetricsService;
import com.coach.linkage.store.AttendanceRepository;
import com.coach.linkage.store.CoachRepository;
import com.coach.linkage.suppression.SuppressionStore;

import java.util.List;
import java.util.Map;

/**
 * Duplicate coaches within a school. Dependent counts are attendance rows per coach.
 */
public class CoachDedupService extends DedupService<Coach> {

    private final CoachRepository coachRepository;
    private final AttendanceRepository attendanceRepository;

    public CoachDedupService(CoachRepository coachRepository, AttendanceRepository attendanceRepository,
                             CoachCandidateGenerator candidateGenerator, CoachMergeEngine mergeEngine,
                             SuppressionStore suppressionStore, MetricsService metricsService) {
        super(CoachMergeEngine.RECORD_KIND, candidateGenerator, mergeEngine, suppressionStore, metricsService);
        this.coachRepository = coachRepository;
        this.attendanceRepository = attendanceRepository;
    }

    @Override
    protected List<Coach> loadRecords() {
        return coachRepository.findAll();
    }

    @Override
    protected Map<String, Integer> loadDependentCounts() {
        return attendanceRepository.countByCoach();
    }
}
