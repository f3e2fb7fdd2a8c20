package com.example.dataflow.core.writer;

import com.example.dataflow.core.model.Row;

import java.util.List;

/**
 * Writes validated rows to a destination table as one atomic unit.
 */
public interface RowWriter {

    /**
     * Inserts all rows in one transaction.
     *
     * @param tableName A table name that already passed identifier validation.
     * @param rows      Rows to insert; an empty list is a no-op.
     * @return The number of committed rows: 0 for empty input, otherwise {@code rows.size()}.
     * @throws com.example.dataflow.core.exception.CommitException if any row fails; nothing is committed.
     */
    int write(String tableName, List<Row> rows);
}
