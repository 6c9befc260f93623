package com.coach.linkage.store;

import com.coach.linkage.core.model.Attendance;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.coach.linkage.store.Tables.*;

/**
 * Access to the {@code attendance} table.
 */
public class AttendanceRepository {

    private final RecordStore store;

    public AttendanceRepository(RecordStore store) {
        this.store = store;
    }

    public List<Attendance> findByCoach(String coachId) {
        return store.select(ATTENDANCE, Map.of(COACH_ID, coachId)).stream()
                .map(AttendanceRepository::fromRow)
                .toList();
    }

    public List<Attendance> insertAll(List<Attendance> records) {
        List<Map<String, Object>> rows = records.stream()
                .map(a -> Map.<String, Object>of(ID, a.id(), GAME_ID, a.gameId(), COACH_ID, a.coachId()))
                .toList();
        return store.insert(ATTENDANCE, rows).stream()
                .map(AttendanceRepository::fromRow)
                .toList();
    }

    /**
     * Points every attendance row of one coach at another coach.
     *
     * @return number of rows repointed
     */
    public int reassign(String fromCoachId, String toCoachId) {
        return store.updateWhere(ATTENDANCE, Map.of(COACH_ID, fromCoachId), Map.of(COACH_ID, toCoachId));
    }

    public void delete(String id) {
        store.delete(ATTENDANCE, id);
    }

    /**
     * Number of attendance rows per coach id, from one read of the table.
     */
    public Map<String, Integer> countByCoach() {
        Map<String, Integer> counts = new HashMap<>();
        for (Map<String, Object> row : store.select(ATTENDANCE, Map.of())) {
            String coachId = asString(row.get(COACH_ID));
            if (coachId != null) {
                counts.merge(coachId, 1, Integer::sum);
            }
        }
        return counts;
    }

    static Attendance fromRow(Map<String, Object> row) {
        return new Attendance(asString(row.get(ID)), asString(row.get(GAME_ID)), asString(row.get(COACH_ID)));
    }
}
