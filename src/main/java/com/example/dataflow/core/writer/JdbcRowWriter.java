package com.example.dataflow.core.writer;

import com.example.dataflow.core.exception.CommitException;
import com.example.dataflow.core.model.Row;
import com.example.dataflow.core.processor.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * {@link RowWriter} over plain JDBC. Rows are inserted one at a time with bound parameters
 * inside a single transaction; the first failing row rolls back the whole batch.
 * <p>
 * Rows may carry different column sets, so each INSERT is built from the row's own columns.
 */
public class JdbcRowWriter implements RowWriter {

    private static final Logger log = LoggerFactory.getLogger(JdbcRowWriter.class);

    private final DataSource dataSource;

    public JdbcRowWriter(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource cannot be null");
    }

    @Override
    public int write(String tableName, List<Row> rows) {
        SqlIdentifiers.requireSafe(tableName);
        if (rows == null || rows.isEmpty()) {
            log.debug("No rows to insert into {}", tableName);
            return 0;
        }

        long startTime = System.nanoTime();
        int inserted = 0;
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            boolean allRowsInserted = false;
            try {
                for (Row row : rows) {
                    insertRow(connection, tableName, row);
                    inserted++;
                }
                allRowsInserted = true;
                connection.commit();
            } catch (SQLException e) {
                rollbackConnection(connection, tableName);
                if (allRowsInserted) {
                    throw new CommitException("tx commit failed: " + e.getMessage(), inserted, e);
                }
                throw new CommitException("insert failed: " + e.getMessage(), inserted, e);
            } catch (RuntimeException e) {
                rollbackConnection(connection, tableName);
                throw e;
            } finally {
                restoreAutoCommit(connection, autoCommit);
            }
        } catch (SQLException e) {
            // Could not obtain or configure a connection
            throw new CommitException("begin tx failed: " + e.getMessage(), 0, e);
        }

        log.debug("Committed {} rows into {} in {} ms", inserted, tableName,
                  TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));
        return inserted;
    }

    private void insertRow(Connection connection, String tableName, Row row) throws SQLException {
        String sql = buildInsertSql(tableName, row.getColumns());
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            int paramIndex = 1;
            for (Row.Value value : row.getValues()) {
                statement.setObject(paramIndex++, value.getValue());
            }
            statement.executeUpdate();
        }
    }

    static String buildInsertSql(String tableName, List<String> columns) {
        String columnsPart = columns.stream()
                                    .map(SqlIdentifiers::quote)
                                    .collect(Collectors.joining(", "));
        String valuesPart = columns.stream()
                                   .map(col -> "?")
                                   .collect(Collectors.joining(", "));
        return String.format("INSERT INTO %s (%s) VALUES (%s)", SqlIdentifiers.quote(tableName), columnsPart, valuesPart);
    }

    private void rollbackConnection(Connection connection, String tableName) {
        try {
            connection.rollback();
            log.warn("Transaction on {} rolled back", tableName);
        } catch (SQLException rollbackEx) {
            log.error("Failed to rollback transaction on {}: {}", tableName, rollbackEx.getMessage(), rollbackEx);
        }
    }

    private void restoreAutoCommit(Connection connection, boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Could not restore autoCommit on pooled connection: {}", e.getMessage());
        }
    }
}
