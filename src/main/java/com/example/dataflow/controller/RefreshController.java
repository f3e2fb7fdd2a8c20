package com.example.dataflow.controller;

import com.example.dataflow.config.DataflowProperties;
import com.example.dataflow.core.RecordIngestor;
import com.example.dataflow.core.SourcePreviewer;
import com.example.dataflow.core.TableRefresher;
import com.example.dataflow.core.exception.CoercionException;
import com.example.dataflow.core.exception.InvalidIdentifierException;
import com.example.dataflow.core.exception.InvalidInputException;
import com.example.dataflow.core.exception.SourceHttpException;
import com.example.dataflow.core.exception.SourceShapeException;
import com.example.dataflow.core.exception.SourceUnreachableException;
import com.example.dataflow.core.exception.TableNotFoundException;
import com.example.dataflow.core.model.RefreshLogEntry;
import com.example.dataflow.core.model.RefreshOutcome;
import com.example.dataflow.repository.JdbcRefreshLogRepository;
import com.example.dataflow.service.RefreshJobManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Manual refresh trigger, read-only views of the audit log and the scheduler, source preview
 * and direct ingest.
 */
@RestController
@RequestMapping("/api/v1")
public class RefreshController {

    private static final Logger log = LoggerFactory.getLogger(RefreshController.class);

    private static final String MDC_TABLE_KEY = "table";

    private final TableRefresher tableRefresher;
    private final SourcePreviewer sourcePreviewer;
    private final RecordIngestor recordIngestor;
    private final JdbcRefreshLogRepository refreshLogRepository;
    private final ObjectProvider<RefreshJobManager> refreshJobManager;
    private final int logLimit;

    public RefreshController(TableRefresher tableRefresher,
                             SourcePreviewer sourcePreviewer,
                             RecordIngestor recordIngestor,
                             JdbcRefreshLogRepository refreshLogRepository,
                             ObjectProvider<RefreshJobManager> refreshJobManager,
                             DataflowProperties properties) {
        this.tableRefresher = tableRefresher;
        this.sourcePreviewer = sourcePreviewer;
        this.recordIngestor = recordIngestor;
        this.refreshLogRepository = refreshLogRepository;
        this.refreshJobManager = refreshJobManager;
        this.logLimit = properties.getMetadata().getLogLimit();
    }

    /**
     * Runs one refresh cycle synchronously. 200 on OK, 500 on an ERROR outcome.
     */
    @PostMapping("/refresh/{table}")
    public ResponseEntity<Map<String, Object>> refresh(@PathVariable("table") String table) {
        MDC.put(MDC_TABLE_KEY, table);
        try {
            log.info("Manual refresh requested for {}", table);
            RefreshOutcome outcome = tableRefresher.refresh(table);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("table", outcome.getTableName());
            response.put("status", outcome.getStatus());
            response.put("message", outcome.getMessage());
            response.put("insertedRows", outcome.getInsertedRows());
            if (!outcome.isOk()) {
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
            }
            return ResponseEntity.ok(response);
        } catch (InvalidInputException e) {
            log.warn("Manual refresh rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("table", table, "status", "FAILED", "message", e.getMessage()));
        } catch (TableNotFoundException e) {
            log.warn("Manual refresh for unknown table {}", table);
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("table", table, "status", "FAILED", "message", e.getMessage()));
        } catch (Exception e) {
            log.error("Manual refresh failed for {}: {}", table, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("table", table, "status", "FAILED", "message", "Refresh failed: " + e.getMessage()));
        } finally {
            MDC.remove(MDC_TABLE_KEY);
        }
    }

    /**
     * Fetches a URL and returns a truncated sample. 400 on a bad URL or a body that is not
     * an object or array of objects, 502 when the source cannot be reached or answers non-2xx.
     */
    @GetMapping("/preview-source")
    public ResponseEntity<Object> previewSource(@RequestParam(name = "url", required = false) String url) {
        try {
            return ResponseEntity.ok(sourcePreviewer.preview(url));
        } catch (InvalidInputException | SourceShapeException e) {
            log.warn("Preview of {} rejected: {}", url, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("url", String.valueOf(url), "message", e.getMessage()));
        } catch (SourceUnreachableException | SourceHttpException e) {
            log.warn("Preview of {} failed: {}", url, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(Map.of("url", url, "message", "Fetch failed: " + e.getMessage()));
        }
    }

    /**
     * Inserts the posted JSON object or array of objects into a registered table in one
     * transaction. 201 on success.
     */
    @PostMapping("/ingest/{table}")
    public ResponseEntity<Map<String, Object>> ingest(@PathVariable("table") String table,
                                                      @RequestBody(required = false) String body) {
        MDC.put(MDC_TABLE_KEY, table);
        try {
            int inserted = recordIngestor.ingest(table, body);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("table", table);
            response.put("insertedRows", inserted);
            response.put("message", "Inserted " + inserted + " rows");
            return ResponseEntity.status(HttpStatus.CREATED).body(response);
        } catch (TableNotFoundException e) {
            log.warn("Ingest for unknown table {}", table);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("table", table, "message", e.getMessage()));
        } catch (InvalidInputException | SourceShapeException | InvalidIdentifierException | CoercionException e) {
            log.warn("Ingest into {} rejected: {}", table, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("table", table, "message", e.getMessage()));
        } catch (Exception e) {
            log.error("Ingest into {} failed: {}", table, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("table", table, "message", "Insert failed: " + e.getMessage()));
        } finally {
            MDC.remove(MDC_TABLE_KEY);
        }
    }

    @GetMapping("/refresh-logs/{table}")
    public ResponseEntity<List<RefreshLogEntry>> refreshLogs(@PathVariable("table") String table,
                                                             @RequestParam(name = "limit", required = false) Integer limit) {
        int effectiveLimit = (limit == null || limit <= 0) ? logLimit : Math.min(limit, logLimit);
        return ResponseEntity.ok(refreshLogRepository.findRecent(table, effectiveLimit));
    }

    @GetMapping("/scheduler/jobs")
    public ResponseEntity<Map<String, Object>> schedulerJobs() {
        Map<String, Object> response = new LinkedHashMap<>();
        RefreshJobManager manager = refreshJobManager.getIfAvailable();
        if (manager == null) {
            response.put("state", "DISABLED");
            response.put("jobs", Map.of());
        } else {
            response.put("state", manager.getState());
            response.put("jobs", manager.getTrackedJobs());
        }
        return ResponseEntity.ok(response);
    }
}
