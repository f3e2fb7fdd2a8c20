package com.example.dataflow.core.exception;

/**
 * The transactional insert failed and the whole batch was rolled back.
 * {@link #getRowsInsertedBeforeFailure()} is diagnostic only: none of those rows remain. When every
 * row was accepted and only the commit failed, it equals the batch size and the message starts
 * with "tx commit failed".
 */
public class CommitException extends EtlProcessingException {

    private final int rowsInsertedBeforeFailure;

    public CommitException(String message, int rowsInsertedBeforeFailure, Throwable cause) {
        super(message, cause);
        this.rowsInsertedBeforeFailure = rowsInsertedBeforeFailure;
    }

    public int getRowsInsertedBeforeFailure() {
        return rowsInsertedBeforeFailure;
    }
}
