package com.example.dataflow.core.exception;

/**
 * Failure while retrieving or decoding the remote JSON source.
 * Always recoverable by trying again on the next cycle.
 */
public abstract class SourceFetchException extends EtlProcessingException {

    protected SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    protected SourceFetchException(String message) {
        super(message);
    }
}
