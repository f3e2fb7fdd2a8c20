package com.example.dataflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Columns of one destination table: column name to lower-cased declared data type.
 */
public final class ColumnCatalog {

    private final String tableName;
    private final Map<String, String> columnTypes;

    public ColumnCatalog(String tableName, Map<String, String> columnTypes) {
        this.tableName = Objects.requireNonNull(tableName, "tableName cannot be null");
        Map<String, String> copy = new LinkedHashMap<>();
        columnTypes.forEach((name, type) -> copy.put(name, type == null ? "" : type.toLowerCase(Locale.ROOT)));
        this.columnTypes = Collections.unmodifiableMap(copy);
    }

    public String getTableName() {
        return tableName;
    }

    public boolean hasColumn(String column) {
        return columnTypes.containsKey(column);
    }

    /**
     * @return the lower-cased declared type, or null if the column is unknown.
     */
    public String typeOf(String column) {
        return columnTypes.get(column);
    }

    public Map<String, String> getColumnTypes() {
        return columnTypes;
    }

    public boolean isEmpty() {
        return columnTypes.isEmpty();
    }

    public int size() {
        return columnTypes.size();
    }
}
