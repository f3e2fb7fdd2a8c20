package com.example.dataflow.repository;

import com.example.dataflow.core.exception.SchemaLoadException;
import com.example.dataflow.core.model.ColumnCatalog;
import com.example.dataflow.core.model.ColumnType;
import com.example.dataflow.core.model.JobSpec;
import com.example.dataflow.core.model.RefreshStatus;
import com.example.dataflow.core.model.TableMetadata;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcTableMetadataRepositoryTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcTableMetadataRepository repository;

    @BeforeEach
    public void setUp() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:metadata_repo;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.update("DELETE FROM table_metadata");
        jdbcTemplate.execute("DROP TABLE IF EXISTS readings");
        repository = new JdbcTableMetadataRepository(jdbcTemplate, "public", "time_series");
    }

    private void register(String table, String type, Integer interval, String url) {
        jdbcTemplate.update("INSERT INTO table_metadata (table_name, table_type, refresh_interval, data_source_url) " +
                            "VALUES (?, ?, ?, ?)", table, type, interval, url);
    }

    @Test
    public void testOnlyEligibleTablesBecomeJobs() {
        register("prices", "time_series", 60, "http://source/prices");
        register("no_interval", "time_series", null, "http://source/x");
        register("no_url", "time_series", 60, null);
        register("blank_url", "time_series", 60, "  ");
        register("zero_interval", "time_series", 0, "http://source/y");
        register("lookup", "static", 60, "http://source/z");

        List<JobSpec> jobs = repository.findRefreshJobs();

        assertEquals(List.of(new JobSpec("prices", 60, "http://source/prices")), jobs);
    }

    @Test
    public void testFindTable() {
        register("prices", "time_series", 60, "http://source/prices");

        Optional<TableMetadata> found = repository.findTable("prices");

        assertTrue(found.isPresent());
        assertEquals("time_series", found.get().getTableType());
        assertEquals(60, found.get().getRefreshInterval());
        assertEquals("http://source/prices", found.get().getDataSourceUrl());
        assertNull(found.get().getStatus());
        assertFalse(repository.findTable("missing").isPresent());
    }

    @Test
    public void testColumnCatalogInDeclaredOrder() {
        jdbcTemplate.execute("CREATE TABLE readings (id INTEGER, v NUMERIC(10, 2), ok BOOLEAN, taken_at TIMESTAMP, note VARCHAR(20))");

        ColumnCatalog catalog = repository.loadColumnCatalog("readings");

        assertEquals(List.of("id", "v", "ok", "taken_at", "note"), new ArrayList<>(catalog.getColumnTypes().keySet()));
        assertEquals(ColumnType.INTEGER, ColumnType.of(catalog.typeOf("id")));
        assertEquals(ColumnType.FLOATING, ColumnType.of(catalog.typeOf("v")));
        assertEquals(ColumnType.BOOLEAN, ColumnType.of(catalog.typeOf("ok")));
        assertEquals(ColumnType.TEMPORAL, ColumnType.of(catalog.typeOf("taken_at")));
        assertEquals(ColumnType.OTHER, ColumnType.of(catalog.typeOf("note")));
    }

    @Test
    public void testMissingTableHasNoCatalog() {
        SchemaLoadException e = assertThrows(SchemaLoadException.class, () -> repository.loadColumnCatalog("readings"));
        assertTrue(e.getMessage().startsWith("failed to load table columns"));
    }

    @Test
    public void testOkStatusStampsSuccessAndClearsError() {
        register("prices", "time_series", 60, "http://source/prices");
        jdbcTemplate.update("UPDATE table_metadata SET last_refresh_error = 'old error' WHERE table_name = 'prices'");

        repository.updateStatus("prices", RefreshStatus.OK, null);

        Map<String, Object> row = jdbcTemplate.queryForMap(
                "SELECT status, last_refresh_success, last_refresh_error FROM table_metadata WHERE table_name = 'prices'");
        assertEquals("OK", row.get("status"));
        assertNotNull(row.get("last_refresh_success"));
        assertNull(row.get("last_refresh_error"));
    }

    @Test
    public void testErrorStatusKeepsLastSuccess() {
        register("prices", "time_series", 60, "http://source/prices");
        repository.updateStatus("prices", RefreshStatus.OK, null);
        Timestamp before = jdbcTemplate.queryForObject(
                "SELECT last_refresh_success FROM table_metadata WHERE table_name = 'prices'", Timestamp.class);

        repository.updateStatus("prices", RefreshStatus.ERROR, "Fetch failed: http status 500: boom");

        Map<String, Object> row = jdbcTemplate.queryForMap(
                "SELECT status, last_refresh_error FROM table_metadata WHERE table_name = 'prices'");
        assertEquals("ERROR", row.get("status"));
        assertEquals("Fetch failed: http status 500: boom", row.get("last_refresh_error"));
        Timestamp after = jdbcTemplate.queryForObject(
                "SELECT last_refresh_success FROM table_metadata WHERE table_name = 'prices'", Timestamp.class);
        assertEquals(before, after);
        assertEquals(RefreshStatus.ERROR, repository.findTable("prices").orElseThrow().getStatus());
    }

    @Test
    public void testUnknownStatusTextMapsToNull() {
        assertNull(JdbcTableMetadataRepository.parseStatus("PENDING"));
        assertEquals(RefreshStatus.OK, JdbcTableMetadataRepository.parseStatus("OK"));
    }
}
