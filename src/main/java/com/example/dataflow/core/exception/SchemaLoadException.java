package com.example.dataflow.core.exception;

/**
 * The column catalog of the destination table could not be loaded.
 */
public class SchemaLoadException extends EtlProcessingException {

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public SchemaLoadException(String message) {
        super(message);
    }
}
