package com.example.dataflow.core.model;

import java.util.Locale;

/**
 * Family of a declared column type, used only to decide how a loosely typed value is coerced.
 * Classification is by substring of the lower-cased type name, checked in declaration order,
 * so "timestamp with time zone" is TEMPORAL and "bigint" is INTEGER.
 */
public enum ColumnType {
    TEMPORAL("timestamp", "date"),
    INTEGER("int"),
    FLOATING("double", "numeric", "real", "float"),
    BOOLEAN("boolean"),
    OTHER;

    private final String[] markers;

    ColumnType(String... markers) {
        this.markers = markers;
    }

    public static ColumnType of(String declaredType) {
        if (declaredType == null) {
            return OTHER;
        }
        String normalized = declaredType.toLowerCase(Locale.ROOT);
        for (ColumnType type : values()) {
            for (String marker : type.markers) {
                if (normalized.contains(marker)) {
                    return type;
                }
            }
        }
        return OTHER;
    }
}
