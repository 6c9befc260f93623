package com.coach.linkage.store;

import com.coach.linkage.error.ConstraintViolationException;
import com.coach.linkage.error.RecordNotFoundException;
import com.coach.linkage.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * In-memory implementation of {@link RecordStore}.
 * Suitable for testing and single-JVM deployments. Enforces the unique
 * (game_id, coach_id) constraint on attendance by default.
 */
public class InMemoryRecordStore implements RecordStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRecordStore.class);

    public static final String ATTENDANCE_UNIQUE = "attendance_game_coach_unique";

    private final Map<String, Map<String, Map<String, Object>>> tables = new HashMap<>();
    private final List<UniqueConstraint> constraints = new ArrayList<>();

    public InMemoryRecordStore() {
        addUniqueConstraint(ATTENDANCE_UNIQUE, Tables.ATTENDANCE, Tables.GAME_ID, Tables.COACH_ID);
    }

    /**
     * Registers a uniqueness constraint over the given columns of a table.
     */
    public synchronized void addUniqueConstraint(String name, String table, String... columns) {
        constraints.add(new UniqueConstraint(name, table, List.of(columns)));
    }

    @Override
    public synchronized List<Map<String, Object>> select(String table, Map<String, Object> filter) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : rows(table).values()) {
            if (matches(row, filter)) {
                result.add(new HashMap<>(row));
            }
        }
        return result;
    }

    @Override
    public synchronized List<Map<String, Object>> insert(String table, List<Map<String, Object>> newRows) {
        Map<String, Map<String, Object>> target = rows(table);
        // Stage first so a violating batch leaves the table untouched
        Map<String, Map<String, Object>> staged = new LinkedHashMap<>(target);
        List<Map<String, Object>> inserted = new ArrayList<>();
        for (Map<String, Object> row : newRows) {
            Map<String, Object> copy = new HashMap<>(row);
            Object id = copy.get(Tables.ID);
            if (id == null) {
                id = UUID.randomUUID().toString();
                copy.put(Tables.ID, id);
            }
            String key = id.toString();
            if (staged.containsKey(key)) {
                throw new ConstraintViolationException(table + "_pkey", "Duplicate id in " + table + ": " + key);
            }
            checkConstraints(table, staged, key, copy);
            staged.put(key, copy);
            inserted.add(new HashMap<>(copy));
        }
        target.clear();
        target.putAll(staged);
        log.debug("Inserted {} rows into {}", inserted.size(), table);
        return inserted;
    }

    @Override
    public synchronized void update(String table, String id, Map<String, Object> fields) {
        Map<String, Map<String, Object>> target = rows(table);
        Map<String, Object> existing = target.get(id);
        if (existing == null) {
            throw new RecordNotFoundException(table, id);
        }
        Map<String, Object> updated = applied(existing, fields);
        checkConstraints(table, target, id, updated);
        target.put(id, updated);
    }

    @Override
    public synchronized int updateWhere(String table, Map<String, Object> filter, Map<String, Object> fields) {
        Map<String, Map<String, Object>> target = rows(table);
        Map<String, Map<String, Object>> staged = new LinkedHashMap<>(target);
        int count = 0;
        for (Map.Entry<String, Map<String, Object>> entry : target.entrySet()) {
            if (matches(entry.getValue(), filter)) {
                Map<String, Object> updated = applied(entry.getValue(), fields);
                checkConstraints(table, staged, entry.getKey(), updated);
                staged.put(entry.getKey(), updated);
                count++;
            }
        }
        target.clear();
        target.putAll(staged);
        return count;
    }

    @Override
    public synchronized void delete(String table, String id) {
        if (rows(table).remove(id) == null) {
            throw new RecordNotFoundException(table, id);
        }
    }

    /**
     * Number of rows currently stored in a table.
     */
    public synchronized int count(String table) {
        return rows(table).size();
    }

    private Map<String, Map<String, Object>> rows(String table) {
        if (table == null || table.isBlank()) {
            throw new StoreException("Table name is required");
        }
        return tables.computeIfAbsent(table, t -> new LinkedHashMap<>());
    }

    private static Map<String, Object> applied(Map<String, Object> row, Map<String, Object> fields) {
        Map<String, Object> updated = new HashMap<>(row);
        fields.forEach((column, value) -> {
            if (!Tables.ID.equals(column)) {
                updated.put(column, value);
            }
        });
        return updated;
    }

    private static boolean matches(Map<String, Object> row, Map<String, Object> filter) {
        if (filter == null) {
            return true;
        }
        for (Map.Entry<String, Object> criterion : filter.entrySet()) {
            if (!Objects.equals(row.get(criterion.getKey()), criterion.getValue())) {
                return false;
            }
        }
        return true;
    }

    private void checkConstraints(String table, Map<String, Map<String, Object>> current,
                                  String id, Map<String, Object> candidate) {
        for (UniqueConstraint constraint : constraints) {
            if (!constraint.table().equals(table)) {
                continue;
            }
            for (Map.Entry<String, Map<String, Object>> other : current.entrySet()) {
                if (!other.getKey().equals(id) && constraint.collides(candidate, other.getValue())) {
                    throw new ConstraintViolationException(constraint.name(),
                            "Duplicate key violates unique constraint " + constraint.name()
                                    + " on " + table + constraint.columns());
                }
            }
        }
    }

    private record UniqueConstraint(String name, String table, List<String> columns) {
        boolean collides(Map<String, Object> a, Map<String, Object> b) {
            for (String column : columns) {
                if (!Objects.equals(a.get(column), b.get(column))) {
                    return false;
                }
            }
            return true;
        }
    }
}
