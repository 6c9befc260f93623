package com.coach.linkage.error;

/**
 * Thrown when a record targeted by a write no longer exists.
 * During a merge this usually means another operator already resolved the pair.
 */
public class RecordNotFoundException extends LinkageException {

    private final String table;
    private final String recordId;

    public RecordNotFoundException(String table, String recordId) {
        super("Record not found in " + table + ": " + recordId);
        this.table = table;
        this.recordId = recordId;
    }

    public String getTable() {
        return table;
    }

    public String getRecordId() {
        return recordId;
    }
}
