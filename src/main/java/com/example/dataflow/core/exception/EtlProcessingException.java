package com.example.dataflow.core.exception;

/**
 * Base exception for failures inside one refresh cycle (fetch, validation, commit).
 * Subclasses identify the failing stage; the pipeline turns any of them into an
 * ERROR {@link com.example.dataflow.core.model.RefreshOutcome}.
 */
public class EtlProcessingException extends RuntimeException {

    public EtlProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    public EtlProcessingException(String message) {
        super(message);
    }
}
