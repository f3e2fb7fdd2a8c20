package com.example.dataflow.core.exception;

public class InvalidIdentifierException extends EtlProcessingException {

    public InvalidIdentifierException(String message) {
        super(message);
    }
}
