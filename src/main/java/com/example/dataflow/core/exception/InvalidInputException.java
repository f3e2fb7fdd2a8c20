package com.example.dataflow.core.exception;

/**
 * Malformed or missing caller-supplied parameter. Raised before any I/O is attempted.
 */
public class InvalidInputException extends EtlProcessingException {

    public InvalidInputException(String message) {
        super(message);
    }
}
