package com.example.dataflow.core.exception;

/**
 * The body was not JSON, or was JSON but neither an object nor an array of objects.
 */
public class SourceShapeException extends SourceFetchException {

    public SourceShapeException(String message, Throwable cause) {
        super(message, cause);
    }

    public SourceShapeException(String message) {
        super(message);
    }
}
