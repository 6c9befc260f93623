package com.coach.linkage.store;

import com.coach.linkage.core.model.School;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.coach.linkage.store.Tables.*;

/**
 * Maps {@link School} records to rows of the {@code schools} table.
 */
public class SchoolRepository {

    private final RecordStore store;

    public SchoolRepository(RecordStore store) {
        this.store = store;
    }

    /**
     * Loads the whole registry in one read, ordered by name.
     */
    public List<School> findAll() {
        return store.select(SCHOOLS, Map.of()).stream()
                .map(SchoolRepository::fromRow)
                .sorted(Comparator.comparing(s -> s.getName() == null ? "" : s.getName().toLowerCase(Locale.ROOT)))
                .toList();
    }

    public Optional<School> findById(String id) {
        return store.select(SCHOOLS, Map.of(ID, id)).stream()
                .findFirst()
                .map(SchoolRepository::fromRow);
    }

    public List<School> insertAll(List<School> schools) {
        List<Map<String, Object>> rows = schools.stream().map(SchoolRepository::toRow).toList();
        return store.insert(SCHOOLS, rows).stream()
                .map(SchoolRepository::fromRow)
                .toList();
    }

    public void update(String id, Map<String, Object> fields) {
        store.update(SCHOOLS, id, fields);
    }

    public void delete(String id) {
        store.delete(SCHOOLS, id);
    }

    static School fromRow(Map<String, Object> row) {
        return School.builder()
                .id(asString(row.get(ID)))
                .name(asString(row.get(SCHOOL)))
                .city(asString(row.get(CITY)))
                .state(asString(row.get(STATE)))
                .division(asString(row.get(DIVISION)))
                .conference(asString(row.get(CONFERENCE)))
                .build();
    }

    static Map<String, Object> toRow(School school) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(ID, school.getId());
        row.put(SCHOOL, school.getName());
        row.put(CITY, school.getCity());
        row.put(STATE, school.getState());
        row.put(DIVISION, school.getDivision());
        row.put(CONFERENCE, school.getConference());
        return row;
    }
}
