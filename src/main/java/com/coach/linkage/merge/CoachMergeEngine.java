package com.coach.linkage.merge;

import com.coach.linkage.core.model.Attendance;
import com.coach.linkage.core.model.Coach;
import com.coach.linkage.metrics.MetricsService;
import com.coach.linkage.store.AttendanceRepository;
import com.coach.linkage.store.CoachRepository;
import com.coach.linkage.store.Tables;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merges duplicate coaches of the same school.
 *
 * <p>Email, phone and title are copied when empty on the keeper. A keeper first name that
 * looks like an initial (see {@link MergePolicy}) is replaced by the loser's longer one.
 * Loser attendance at a game the keeper also attended is deleted instead of repointed, so
 * the one-row-per-(game, coach) rule holds after the merge.</p>
 */
public class CoachMergeEngine extends MergeEngine<Coach> {

    public static final String RECORD_KIND = "coach";

    private final CoachRepository coachRepository;
    private final AttendanceRepository attendanceRepository;
    private final MergePolicy policy;

    public CoachMergeEngine(CoachRepository coachRepository, AttendanceRepository attendanceRepository) {
        this(coachRepository, attendanceRepository, MergePolicy.defaults(), null);
    }

    public CoachMergeEngine(CoachRepository coachRepository, AttendanceRepository attendanceRepository,
                            MergePolicy policy, MetricsService metricsService) {
        super(RECORD_KIND, metricsService);
        this.coachRepository = coachRepository;
        this.attendanceRepository = attendanceRepository;
        this.policy = policy;
    }

    @Override
    protected Optional<Coach> load(String id) {
        return coachRepository.findById(id);
    }

    @Override
    protected void requireMergeable(Coach keeper, Coach loser) {
        requireSame(keeper.getSchoolId(), loser.getSchoolId(),
                "Coaches " + keeper.getId() + " and " + loser.getId() + " belong to different schools");
    }

    @Override
    protected FieldReconciliation<Coach> reconcile(Coach keeper, Coach loser) {
        Map<String, Object> updates = new LinkedHashMap<>();
        List<String> mergedFields = new ArrayList<>();
        Coach.Builder updated = Coach.builder(keeper);

        if (policy.prefersLoserFirstName(keeper.getFirstName(), loser.getFirstName())) {
            updates.put(Tables.FIRST_NAME, loser.getFirstName().trim());
            mergedFields.add("first name");
            updated.firstName(loser.getFirstName().trim());
        }
        if (isBlank(keeper.getEmail()) && !isBlank(loser.getEmail())) {
            updates.put(Tables.EMAIL, loser.getEmail());
            mergedFields.add("email");
            updated.email(loser.getEmail());
        }
        if (isBlank(keeper.getPhone()) && !isBlank(loser.getPhone())) {
            updates.put(Tables.PHONE, loser.getPhone());
            mergedFields.add("phone");
            updated.phone(loser.getPhone());
        }
        if (isBlank(keeper.getTitle()) && !isBlank(loser.getTitle())) {
            updates.put(Tables.TITLE, loser.getTitle());
            mergedFields.add("title");
            updated.title(loser.getTitle());
        }
        return new FieldReconciliation<>(updated.build(), updates, mergedFields);
    }

    @Override
    protected void applyUpdates(String keeperId, Map<String, Object> updates) {
        coachRepository.update(keeperId, updates);
    }

    @Override
    protected MergeStep dependentStep() {
        return MergeStep.REPOINT_ATTENDANCE;
    }

    @Override
    protected DependentMove moveDependents(String keeperId, String loserId) {
        Set<String> keeperGames = attendanceRepository.findByCoach(keeperId).stream()
                .map(Attendance::gameId)
                .collect(Collectors.toSet());
        int dropped = 0;
        for (Attendance attendance : attendanceRepository.findByCoach(loserId)) {
            if (keeperGames.contains(attendance.gameId())) {
                attendanceRepository.delete(attendance.id());
                dropped++;
            }
        }
        int moved = attendanceRepository.reassign(loserId, keeperId);
        return new DependentMove(moved, dropped);
    }

    @Override
    protected void deleteLoser(String loserId) {
        coachRepository.delete(loserId);
    }

    @Override
    protected String dependentLabel(int count) {
        return count + " attendance record" + (count == 1 ? "" : "s");
    }
}
