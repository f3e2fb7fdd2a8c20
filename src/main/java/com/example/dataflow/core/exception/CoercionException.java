package com.example.dataflow.core.exception;

/**
 * A composite value (nested object or list) could not be serialized to JSON text.
 */
public class CoercionException extends EtlProcessingException {

    private final String column;

    public CoercionException(String column, String message, Throwable cause) {
        super(column != null ? "column " + column + ": " + message : message, cause);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
