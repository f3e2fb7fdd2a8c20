package com.example.dataflow.core.exception;

public class EmptyInputException extends InvalidInputException {

    public EmptyInputException(String message) {
        super(message);
    }
}
