package com.example.dataflow.repository;

import com.example.dataflow.core.metadata.AuditWriter;
import com.example.dataflow.core.model.RefreshLogEntry;
import com.example.dataflow.core.model.RefreshStatus;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;

/**
 * {@code refresh_logs}: appended once per cycle, read back newest first.
 */
public class JdbcRefreshLogRepository implements AuditWriter {

    private final JdbcTemplate jdbcTemplate;

    public JdbcRefreshLogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "JdbcTemplate cannot be null");
    }

    @Override
    public void append(String tableName, RefreshStatus status, String message) {
        jdbcTemplate.update("INSERT INTO refresh_logs (table_name, status, message) VALUES (?, ?, ?)",
                            tableName, status.name(), message);
    }

    public List<RefreshLogEntry> findRecent(String tableName, int limit) {
        return jdbcTemplate.query(
                "SELECT id, table_name, status, message, created_at FROM refresh_logs " +
                "WHERE table_name = ? ORDER BY created_at DESC, id DESC LIMIT ?",
                (rs, rowNum) -> {
                    RefreshLogEntry entry = new RefreshLogEntry();
                    entry.setId(rs.getLong("id"));
                    entry.setTableName(rs.getString("table_name"));
                    entry.setStatus(JdbcTableMetadataRepository.parseStatus(rs.getString("status")));
                    entry.setMessage(rs.getString("message"));
                    Timestamp createdAt = rs.getTimestamp("created_at");
                    entry.setCreatedAt(createdAt != null ? createdAt.toInstant() : null);
                    return entry;
                },
                tableName, limit);
    }
}
