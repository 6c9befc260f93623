package com.coach.linkage.store;

import com.coach.linkage.core.model.Coach;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.coach.linkage.store.Tables.*;

/**
 * Maps {@link Coach} records to rows of the {@code coaches} table.
 */
public class CoachRepository {

    private static final Comparator<Coach> BY_LAST_NAME =
            Comparator.comparing(c -> c.getLastName() == null ? "" : c.getLastName().toLowerCase(Locale.ROOT));

    private final RecordStore store;

    public CoachRepository(RecordStore store) {
        this.store = store;
    }

    /**
     * Loads every coach in one read, ordered by last name.
     */
    public List<Coach> findAll() {
        return store.select(COACHES, Map.of()).stream()
                .map(CoachRepository::fromRow)
                .sorted(BY_LAST_NAME)
                .toList();
    }

    public Optional<Coach> findById(String id) {
        return store.select(COACHES, Map.of(ID, id)).stream()
                .findFirst()
                .map(CoachRepository::fromRow);
    }

    public List<Coach> insertAll(List<Coach> coaches) {
        List<Map<String, Object>> rows = coaches.stream().map(CoachRepository::toRow).toList();
        return store.insert(COACHES, rows).stream()
                .map(CoachRepository::fromRow)
                .toList();
    }

    public void update(String id, Map<String, Object> fields) {
        store.update(COACHES, id, fields);
    }

    public void delete(String id) {
        store.delete(COACHES, id);
    }

    /**
     * Moves every coach of one school to another.
     *
     * @return number of coaches moved
     */
    public int reassignSchool(String fromSchoolId, String toSchoolId) {
        return store.updateWhere(COACHES, Map.of(SCHOOL_ID, fromSchoolId), Map.of(SCHOOL_ID, toSchoolId));
    }

    /**
     * Number of coaches per school id, from one read of the table.
     */
    public Map<String, Integer> countBySchool() {
        Map<String, Integer> counts = new HashMap<>();
        for (Map<String, Object> row : store.select(COACHES, Map.of())) {
            String schoolId = asString(row.get(SCHOOL_ID));
            if (schoolId != null) {
                counts.merge(schoolId, 1, Integer::sum);
            }
        }
        return counts;
    }

    static Coach fromRow(Map<String, Object> row) {
        return Coach.builder()
                .id(asString(row.get(ID)))
                .firstName(asString(row.get(FIRST_NAME)))
                .lastName(asString(row.get(LAST_NAME)))
                .email(asString(row.get(EMAIL)))
                .phone(asString(row.get(PHONE)))
                .title(asString(row.get(TITLE)))
                .schoolId(asString(row.get(SCHOOL_ID)))
                .build();
    }

    static Map<String, Object> toRow(Coach coach) {
        // LinkedHashMap: Map.of rejects the null optional columns
        Map<String, Object> row = new LinkedHashMap<>();
        if (coach.getId() != null) {
            row.put(ID, coach.getId());
        }
        row.put(FIRST_NAME, coach.getFirstName());
        row.put(LAST_NAME, coach.getLastName());
        row.put(EMAIL, coach.getEmail());
        row.put(PHONE, coach.getPhone());
        row.put(TITLE, coach.getTitle());
        row.put(SCHOOL_ID, coach.getSchoolId());
        return row;
    }
}
