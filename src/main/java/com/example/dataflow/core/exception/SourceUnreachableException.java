package com.example.dataflow.core.exception;

public class SourceUnreachableException extends SourceFetchException {

    public SourceUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
