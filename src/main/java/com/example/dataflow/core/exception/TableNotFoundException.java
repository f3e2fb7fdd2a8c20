package com.example.dataflow.core.exception;

public class TableNotFoundException extends EtlProcessingException {

    private final String tableName;

    public TableNotFoundException(String tableName) {
        super("table not found: " + tableName);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
