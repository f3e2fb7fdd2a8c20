package com.example.dataflow.core;

import com.example.dataflow.core.exception.InvalidInputException;
import com.example.dataflow.core.exception.TableNotFoundException;
import com.example.dataflow.core.metadata.AuditWriter;
import com.example.dataflow.core.model.RefreshLogEntry;
import com.example.dataflow.core.model.RefreshOutcome;
import com.example.dataflow.core.model.RefreshStatus;
import com.example.dataflow.core.processor.PayloadNormalizer;
import com.example.dataflow.core.processor.RowValidator;
import com.example.dataflow.core.processor.TypeCoercer;
import com.example.dataflow.core.reader.HttpSourceFetcher;
import com.example.dataflow.core.writer.JdbcRowWriter;
import com.example.dataflow.repository.JdbcRefreshLogRepository;
import com.example.dataflow.repository.JdbcTableMetadataRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RefreshPipelineTest {

    private static HttpServer server;
    private static String baseUrl;
    private static final AtomicInteger sourceHits = new AtomicInteger();

    private JdbcTemplate jdbcTemplate;
    private JdbcTableMetadataRepository metadataRepository;
    private JdbcRefreshLogRepository logRepository;
    private JdbcDataSource dataSource;
    private RefreshPipeline pipeline;

    @BeforeAll
    public static void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        respond("/metrics", 200, "[{\"id\": 1, \"v\": \"3.5\", \"unknown\": \"dropped\"}]");
        respond("/nested", 200, "{\"id\": 2, \"reading\": {\"v\": 1.25}}");
        respond("/bad-id", 200, "[{\"id\": 1}, {\"id\": \"abc\"}]");
        respond("/only-unknown", 200, "[{\"other\": 1}]");
        respond("/empty", 200, "[]");
        respond("/error", 500, "boom");
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterAll
    public static void stopServer() {
        server.stop(0);
    }

    private static void respond(String path, int status, String body) {
        server.createContext(path, exchange -> {
            sourceHits.incrementAndGet();
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
    }

    @BeforeEach
    public void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:pipeline;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.update("DELETE FROM table_metadata");
        jdbcTemplate.update("DELETE FROM refresh_logs");
        jdbcTemplate.execute("DROP TABLE IF EXISTS metrics");
        jdbcTemplate.execute("CREATE TABLE metrics (id INTEGER, v NUMERIC(10, 2), \"reading.v\" NUMERIC(10, 2))");

        metadataRepository = new JdbcTableMetadataRepository(jdbcTemplate, "public", "time_series");
        logRepository = new JdbcRefreshLogRepository(jdbcTemplate);
        pipeline = newPipeline(logRepository);
    }

    private RefreshPipeline newPipeline(AuditWriter auditWriter) {
        ObjectMapper objectMapper = new ObjectMapper();
        TypeCoercer coercer = new TypeCoercer(objectMapper);
        HttpSourceFetcher fetcher = new HttpSourceFetcher(HttpClient.newHttpClient(), objectMapper, Duration.ofSeconds(5), 2048);
        return new RefreshPipeline(metadataRepository, metadataRepository, auditWriter, fetcher,
                                   new PayloadNormalizer(), new RowValidator(metadataRepository, coercer),
                                   new JdbcRowWriter(dataSource));
    }

    private void register(String table, String path) {
        jdbcTemplate.update("INSERT INTO table_metadata (table_name, table_type, refresh_interval, data_source_url) " +
                            "VALUES (?, 'time_series', 60, ?)", table, path == null ? null : baseUrl + path);
    }

    private Map<String, Object> metadataRow(String table) {
        return jdbcTemplate.queryForMap(
                "SELECT status, last_refresh_success, last_refresh_error FROM table_metadata WHERE table_name = ?", table);
    }

    @Test
    public void testSuccessfulCycleCommitsAndReports() {
        register("metrics", "/metrics");

        RefreshOutcome outcome = pipeline.refresh("metrics");

        assertEquals(RefreshStatus.OK, outcome.getStatus());
        assertEquals("Inserted 1 rows", outcome.getMessage());
        assertEquals(1, outcome.getInsertedRows());

        Map<String, Object> stored = jdbcTemplate.queryForMap("SELECT id, v FROM metrics");
        assertEquals(1, ((Number) stored.get("id")).intValue());
        assertEquals(0, new BigDecimal("3.5").compareTo((BigDecimal) stored.get("v")));

        Map<String, Object> metadata = metadataRow("metrics");
        assertEquals("OK", metadata.get("status"));
        assertNotNull(metadata.get("last_refresh_success"));
        assertNull(metadata.get("last_refresh_error"));

        List<RefreshLogEntry> logs = logRepository.findRecent("metrics", 10);
        assertEquals(1, logs.size());
        assertEquals(RefreshStatus.OK, logs.get(0).getStatus());
        assertEquals("Inserted 1 rows", logs.get(0).getMessage());
    }

    @Test
    public void testNestedFieldsLandInDottedColumns() {
        register("metrics", "/nested");

        RefreshOutcome outcome = pipeline.refresh("metrics");

        assertTrue(outcome.isOk(), outcome.getMessage());
        BigDecimal nested = jdbcTemplate.queryForObject("SELECT \"reading.v\" FROM metrics WHERE id = 2", BigDecimal.class);
        assertEquals(0, new BigDecimal("1.25").compareTo(nested));
    }

    @Test
    public void testHttpErrorFailsFetchStage() {
        register("metrics", "/error");

        RefreshOutcome outcome = pipeline.refresh("metrics");

        assertEquals(RefreshStatus.ERROR, outcome.getStatus());
        assertTrue(outcome.getMessage().startsWith("Fetch failed: "), outcome.getMessage());
        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM metrics", Integer.class));

        Map<String, Object> metadata = metadataRow("metrics");
        assertEquals("ERROR", metadata.get("status"));
        assertEquals(outcome.getMessage(), metadata.get("last_refresh_error"));
        assertNull(metadata.get("last_refresh_success"));

        List<RefreshLogEntry> logs = logRepository.findRecent("metrics", 10);
        assertEquals(1, logs.size());
        assertEquals(RefreshStatus.ERROR, logs.get(0).getStatus());
    }

    @Test
    public void testFailureKeepsPreviousSuccessTimestamp() {
        register("metrics", "/metrics");
        pipeline.refresh("metrics");
        Object firstSuccess = metadataRow("metrics").get("last_refresh_success");

        jdbcTemplate.update("UPDATE table_metadata SET data_source_url = ? WHERE table_name = 'metrics'", baseUrl + "/error");
        RefreshOutcome outcome = pipeline.refresh("metrics");

        assertFalse(outcome.isOk());
        assertEquals(firstSuccess, metadataRow("metrics").get("last_refresh_success"));
        assertEquals(2, logRepository.findRecent("metrics", 10).size());
    }

    @Test
    public void testMissingDestinationFailsValidation() {
        register("absent_table", "/metrics");

        RefreshOutcome outcome = pipeline.refresh("absent_table");

        assertEquals(RefreshStatus.ERROR, outcome.getStatus());
        assertTrue(outcome.getMessage().startsWith("Validation failed: "), outcome.getMessage());
    }

    @Test
    public void testBadRowRollsBackAndFailsInsertStage() {
        register("metrics", "/bad-id");

        RefreshOutcome outcome = pipeline.refresh("metrics");

        assertEquals(RefreshStatus.ERROR, outcome.getStatus());
        assertTrue(outcome.getMessage().startsWith("Insert failed: "), outcome.getMessage());
        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM metrics", Integer.class));
    }

    @Test
    public void testEmptyPayloadFailsValidation() {
        register("metrics", "/empty");

        RefreshOutcome outcome = pipeline.refresh("metrics");

        assertEquals("Validation failed: no rows to validate", outcome.getMessage());
    }

    @Test
    public void testNoMatchingColumnsInsertsNothing() {
        register("metrics", "/only-unknown");

        RefreshOutcome outcome = pipeline.refresh("metrics");

        assertTrue(outcome.isOk());
        assertEquals("Inserted 0 rows", outcome.getMessage());
    }

    @Test
    public void testMissingUrlFailsFetchWithoutNetworkCall() {
        register("metrics", null);
        int hitsBefore = sourceHits.get();

        RefreshOutcome outcome = pipeline.refresh("metrics");

        assertTrue(outcome.getMessage().startsWith("Fetch failed: empty data source url"), outcome.getMessage());
        assertEquals(hitsBefore, sourceHits.get());
    }

    @Test
    public void testUnknownOrBlankTableIsRejected() {
        assertThrows(TableNotFoundException.class, () -> pipeline.refresh("nowhere"));
        assertThrows(InvalidInputException.class, () -> pipeline.refresh(" "));
        assertTrue(logRepository.findRecent("nowhere", 10).isEmpty());
    }

    @Test
    public void testAuditFailureDoesNotBreakCycle() {
        register("metrics", "/metrics");
        RefreshPipeline failingAudit = newPipeline((table, status, message) -> {
            throw new IllegalStateException("audit store down");
        });

        RefreshOutcome outcome = failingAudit.refresh("metrics");

        assertTrue(outcome.isOk());
        assertEquals("OK", metadataRow("metrics").get("status"));
    }
}
