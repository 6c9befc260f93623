package com.coach.linkage.store;

import java.util.List;
import java.util.Map;

/**
 * Minimal relational store the linkage core reads from and writes to.
 * Rows are column-name to value maps; every row carries a string {@code id}.
 *
 * <p>Implementations report failures with the {@code com.coach.linkage.error} types:
 * {@link com.coach.linkage.error.RecordNotFoundException} when an id-targeted write
 * finds no row, {@link com.coach.linkage.error.ConstraintViolationException} for
 * uniqueness violations and {@link com.coach.linkage.error.StoreException} for
 * anything else.</p>
 */
public interface RecordStore {

    /**
     * Returns rows of {@code table} whose columns equal every entry of {@code filter}.
     * An empty filter selects the whole table.
     */
    List<Map<String, Object>> select(String table, Map<String, Object> filter);

    /**
     * Inserts rows, generating ids where absent, and returns the stored rows.
     */
    List<Map<String, Object>> insert(String table, List<Map<String, Object>> rows);

    /**
     * Updates the given columns of one row.
     */
    void update(String table, String id, Map<String, Object> fields);

    /**
     * Updates the given columns of every row matching {@code filter}.
     *
     * @return number of rows updated
     */
    int updateWhere(String table, Map<String, Object> filter, Map<String, Object> fields);

    /**
     * Deletes one row.
     */
    void delete(String table, String id);
}
