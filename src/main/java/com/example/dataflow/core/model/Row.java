package com.example.dataflow.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A store-ready row: an ordered list of (column, value) pairs.
 * Column order is the order in which values were added and is the order of the
 * generated INSERT column list.
 */
public final class Row {

    private final List<Value> values;

    private Row(List<Value> values) {
        this.values = Collections.unmodifiableList(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Value> getValues() {
        return values;
    }

    public List<String> getColumns() {
        List<String> columns = new ArrayList<>(values.size());
        for (Value value : values) {
            columns.add(value.getColumn());
        }
        return columns;
    }

    public Object getValue(String column) {
        for (Value value : values) {
            if (value.getColumn().equals(column)) {
                return value.getValue();
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row{" + values + '}';
    }

    public static final class Value {
        private final String column;
        private final Object value;

        public Value(String column, Object value) {
            this.column = Objects.requireNonNull(column, "column cannot be null");
            this.value = value;
        }

        public String getColumn() {
            return column;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Value that = (Value) o;
            return column.equals(that.column) && Objects.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(column, value);
        }

        @Override
        public String toString() {
            return column + "=" + value;
        }
    }

    public static final class Builder {
        private final List<Value> values = new ArrayList<>();

        private Builder() {
        }

        public Builder add(String column, Object value) {
            values.add(new Value(column, value));
            return this;
        }

        public Row build() {
            return new Row(new ArrayList<>(values));
        }
    }
}
