package com.example.dataflow.core.metadata;

import com.example.dataflow.core.model.RefreshStatus;

/**
 * Append-only refresh log. Entries are never updated or deleted.
 */
public interface AuditWriter {

    void append(String tableName, RefreshStatus status, String message);
}
