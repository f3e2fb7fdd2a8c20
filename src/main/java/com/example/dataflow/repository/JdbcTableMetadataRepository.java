package com.example.dataflow.repository;

import com.example.dataflow.core.exception.SchemaLoadException;
import com.example.dataflow.core.metadata.MetadataReader;
import com.example.dataflow.core.metadata.MetadataWriter;
import com.example.dataflow.core.model.ColumnCatalog;
import com.example.dataflow.core.model.JobSpec;
import com.example.dataflow.core.model.RefreshStatus;
import com.example.dataflow.core.model.TableMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@code table_metadata} access plus column catalog lookup through {@code information_schema}.
 */
public class JdbcTableMetadataRepository implements MetadataReader, MetadataWriter {

    private static final Logger log = LoggerFactory.getLogger(JdbcTableMetadataRepository.class);

    private static final String SELECT_COLUMNS =
            "SELECT table_name, table_type, refresh_interval, data_source_url, status, " +
            "last_refresh_success, last_refresh_error FROM table_metadata";

    private final JdbcTemplate jdbcTemplate;
    private final String schema;
    private final String periodicTableType;
    private final RowMapper<TableMetadata> rowMapper = this::mapRow;

    public JdbcTableMetadataRepository(JdbcTemplate jdbcTemplate, String schema, String periodicTableType) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "JdbcTemplate cannot be null");
        this.schema = Objects.requireNonNull(schema, "schema cannot be null");
        this.periodicTableType = Objects.requireNonNull(periodicTableType, "periodicTableType cannot be null");
    }

    @Override
    public List<JobSpec> findRefreshJobs() {
        String sql = SELECT_COLUMNS +
                     " WHERE table_type = ? AND refresh_interval IS NOT NULL AND data_source_url IS NOT NULL";
        List<TableMetadata> tables = jdbcTemplate.query(sql, rowMapper, periodicTableType);
        // Zero/negative intervals and blank URLs are filtered here rather than in SQL
        return tables.stream()
                     .filter(t -> t.isRefreshable(periodicTableType))
                     .map(TableMetadata::toJobSpec)
                     .collect(Collectors.toList());
    }

    @Override
    public Optional<TableMetadata> findTable(String tableName) {
        List<TableMetadata> found = jdbcTemplate.query(SELECT_COLUMNS + " WHERE table_name = ?", rowMapper, tableName);
        return found.stream().findFirst();
    }

    @Override
    public ColumnCatalog loadColumnCatalog(String tableName) {
        String sql = "SELECT column_name, data_type FROM information_schema.columns " +
                     "WHERE table_schema = ? AND table_name = ? ORDER BY ordinal_position";
        Map<String, String> columns = new LinkedHashMap<>();
        try {
            jdbcTemplate.query(sql, rs -> {
                columns.put(rs.getString("column_name"), rs.getString("data_type"));
            }, schema, tableName);
        } catch (DataAccessException e) {
            throw new SchemaLoadException("failed to load table columns: " + e.getMostSpecificCause().getMessage(), e);
        }
        if (columns.isEmpty()) {
            throw new SchemaLoadException("failed to load table columns: no columns found for " + schema + "." + tableName);
        }
        log.debug("Loaded {} columns for {}.{}", columns.size(), schema, tableName);
        return new ColumnCatalog(tableName, columns);
    }

    @Override
    public void updateStatus(String tableName, RefreshStatus status, String errorMessage) {
        int updated;
        if (status == RefreshStatus.OK) {
            updated = jdbcTemplate.update(
                    "UPDATE table_metadata SET last_refresh_success = CURRENT_TIMESTAMP, last_refresh_error = NULL, " +
                    "status = ?, updated_at = CURRENT_TIMESTAMP WHERE table_name = ?",
                    status.name(), tableName);
        } else {
            updated = jdbcTemplate.update(
                    "UPDATE table_metadata SET last_refresh_error = ?, status = ?, updated_at = CURRENT_TIMESTAMP " +
                    "WHERE table_name = ?",
                    errorMessage, status.name(), tableName);
        }
        if (updated == 0) {
            log.warn("Status update for {} matched no metadata row", tableName);
        }
    }

    private TableMetadata mapRow(ResultSet rs, int rowNum) throws SQLException {
        TableMetadata metadata = new TableMetadata();
        metadata.setTableName(rs.getString("table_name"));
        metadata.setTableType(rs.getString("table_type"));
        int interval = rs.getInt("refresh_interval");
        metadata.setRefreshInterval(rs.wasNull() ? null : interval);
        metadata.setDataSourceUrl(rs.getString("data_source_url"));
        metadata.setStatus(parseStatus(rs.getString("status")));
        Timestamp lastSuccess = rs.getTimestamp("last_refresh_success");
        metadata.setLastRefreshSuccess(lastSuccess != null ? lastSuccess.toInstant() : null);
        metadata.setLastRefreshError(rs.getString("last_refresh_error"));
        return metadata;
    }

    static RefreshStatus parseStatus(String status) {
        if (status == null) {
            return null;
        }
        try {
            return RefreshStatus.valueOf(status);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown refresh status '{}' in table_metadata", status);
            return null;
        }
    }
}
