package com.example.dataflow.core.model;

import java.util.Objects;

/**
 * Result of one refresh cycle for one table. The same shape is returned by scheduled
 * cycles and by the manual trigger, and is recorded both in the audit log and as the
 * table's current status.
 */
public final class RefreshOutcome {

    private final String tableName;
    private final RefreshStatus status;
    private final String message;
    private final int insertedRows;

    private RefreshOutcome(String tableName, RefreshStatus status, String message, int insertedRows) {
        this.tableName = Objects.requireNonNull(tableName, "tableName cannot be null");
        this.status = Objects.requireNonNull(status, "status cannot be null");
        this.message = message;
        this.insertedRows = insertedRows;
    }

    public static RefreshOutcome ok(String tableName, int insertedRows) {
        return new RefreshOutcome(tableName, RefreshStatus.OK, String.format("Inserted %d rows", insertedRows), insertedRows);
    }

    public static RefreshOutcome error(String tableName, String message) {
        return new RefreshOutcome(tableName, RefreshStatus.ERROR, message, 0);
    }

    public String getTableName() {
        return tableName;
    }

    public RefreshStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public int getInsertedRows() {
        return insertedRows;
    }

    public boolean isOk() {
        return status == RefreshStatus.OK;
    }

    @Override
    public String toString() {
        return "RefreshOutcome{" +
               "tableName='" + tableName + '\'' +
               ", status=" + status +
               ", message='" + message + '\'' +
               ", insertedRows=" + insertedRows +
               '}';
    }
}
