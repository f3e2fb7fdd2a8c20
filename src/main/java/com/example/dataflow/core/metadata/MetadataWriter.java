package com.example.dataflow.core.metadata;

import com.example.dataflow.core.model.RefreshStatus;

/**
 * Write access to the current refresh status of a table.
 */
public interface MetadataWriter {

    /**
     * Records the current status of a table. OK stamps the success time and clears the last
     * error; ERROR sets the last error and leaves the success time untouched.
     *
     * @param tableName    The table name.
     * @param status       The outcome of the latest cycle.
     * @param errorMessage The error to record, ignored for OK.
     */
    void updateStatus(String tableName, RefreshStatus status, String errorMessage);
}
