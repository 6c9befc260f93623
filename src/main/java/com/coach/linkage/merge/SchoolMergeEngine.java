package com.coach.linkage.merge;

import com.coach.linkage.core.model.School;
import com.coach.linkage.metrics.MetricsService;
import com.coach.linkage.store.CoachRepository;
import com.coach.linkage.store.SchoolRepository;
import com.coach.linkage.store.Tables;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges duplicate schools: fills the keeper's empty city, state, division and conference
 * from the loser, moves the loser's coaches to the keeper, then deletes the loser.
 * Coaches that become duplicates at the keeper show up in the next coach scan.
 */
public class SchoolMergeEngine extends MergeEngine<School> {

    public static final String RECORD_KIND = "school";

    private final SchoolRepository schoolRepository;
    private final CoachRepository coachRepository;

    public SchoolMergeEngine(SchoolRepository schoolRepository, CoachRepository coachRepository) {
        this(schoolRepository, coachRepository, null);
    }

    public SchoolMergeEngine(SchoolRepository schoolRepository, CoachRepository coachRepository,
                             MetricsService metricsService) {
        super(RECORD_KIND, metricsService);
        this.schoolRepository = schoolRepository;
        this.coachRepository = coachRepository;
    }

    @Override
    protected Optional<School> load(String id) {
        return schoolRepository.findById(id);
    }

    @Override
    protected void requireMergeable(School keeper, School loser) {
        // Any two schools may be merged.
    }

    @Override
    protected FieldReconciliation<School> reconcile(School keeper, School loser) {
        Map<String, Object> updates = new LinkedHashMap<>();
        List<String> mergedFields = new ArrayList<>();
        School.Builder updated = School.builder(keeper);

        if (isBlank(keeper.getCity()) && !isBlank(loser.getCity())) {
            updates.put(Tables.CITY, loser.getCity());
            mergedFields.add("city");
            updated.city(loser.getCity());
        }
        if (isBlank(keeper.getState()) && !isBlank(loser.getState())) {
            updates.put(Tables.STATE, loser.getState());
            mergedFields.add("state");
            updated.state(loser.getState());
        }
        if (isBlank(keeper.getConference()) && !isBlank(loser.getConference())) {
            updates.put(Tables.CONFERENCE, loser.getConference());
            mergedFields.add("conference");
            updated.conference(loser.getConference());
        }
        if (isBlank(keeper.getDivision()) && !isBlank(loser.getDivision())) {
            updates.put(Tables.DIVISION, loser.getDivision());
            mergedFields.add("division");
            updated.division(loser.getDivision());
        }
        return new FieldReconciliation<>(updated.build(), updates, mergedFields);
    }

    @Override
    protected void applyUpdates(String keeperId, Map<String, Object> updates) {
        schoolRepository.update(keeperId, updates);
    }

    @Override
    protected MergeStep dependentStep() {
        return MergeStep.REPOINT_COACHES;
    }

    @Override
    protected DependentMove moveDependents(String keeperId, String loserId) {
        return new DependentMove(coachRepository.reassignSchool(loserId, keeperId), 0);
    }

    @Override
    protected void deleteLoser(String loserId) {
        schoolRepository.delete(loserId);
    }

    @Override
    protected String dependentLabel(int count) {
        return count + " coach" + (count == 1 ? "" : "es");
    }
}
