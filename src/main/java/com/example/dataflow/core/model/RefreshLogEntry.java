package com.example.dataflow.core.model;

import java.time.Instant;

/**
 * One append-only audit record of a refresh cycle.
 */
public class RefreshLogEntry {

    private long id;
    private String tableName;
    private RefreshStatus status;
    private String message;
    private Instant createdAt;

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }
    public String getTableName() { return tableName; }
    public void setTableName(String tableName) { this.tableName = tableName; }
    public RefreshStatus getStatus() { return status; }
    public void setStatus(RefreshStatus status) { this.status = status; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
