package com.example.dataflow.core;

import com.example.dataflow.core.exception.EtlProcessingException;
import com.example.dataflow.core.exception.InvalidInputException;
import com.example.dataflow.core.exception.TableNotFoundException;
import com.example.dataflow.core.metadata.AuditWriter;
import com.example.dataflow.core.metadata.MetadataReader;
import com.example.dataflow.core.metadata.MetadataWriter;
import com.example.dataflow.core.model.RefreshOutcome;
import com.example.dataflow.core.model.Row;
import com.example.dataflow.core.model.TableMetadata;
import com.example.dataflow.core.processor.PayloadNormalizer;
import com.example.dataflow.core.processor.RowValidator;
import com.example.dataflow.core.reader.SourceFetcher;
import com.example.dataflow.core.writer.RowWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * One refresh cycle for one table: FETCH, TRANSFORM, VALIDATE, COMMIT, then REPORT.
 * <p>
 * The first failing stage ends the cycle with an ERROR outcome whose message is prefixed by
 * the stage ("Fetch failed: ", "Validation failed: ", "Insert failed: "). Stage errors never
 * escape this class. REPORT appends to the audit log and then updates the table's status;
 * both writes are best-effort.
 */
public class RefreshPipeline implements TableRefresher {

    private static final Logger log = LoggerFactory.getLogger(RefreshPipeline.class);

    static final String MDC_TABLE_KEY = "table";

    private final MetadataReader metadataReader;
    private final MetadataWriter metadataWriter;
    private final AuditWriter auditWriter;
    private final SourceFetcher sourceFetcher;
    private final PayloadNormalizer normalizer;
    private final RowValidator rowValidator;
    private final RowWriter rowWriter;

    public RefreshPipeline(MetadataReader metadataReader,
                           MetadataWriter metadataWriter,
                           AuditWriter auditWriter,
                           SourceFetcher sourceFetcher,
                           PayloadNormalizer normalizer,
                           RowValidator rowValidator,
                           RowWriter rowWriter) {
        this.metadataReader = Objects.requireNonNull(metadataReader, "MetadataReader cannot be null");
        this.metadataWriter = Objects.requireNonNull(metadataWriter, "MetadataWriter cannot be null");
        this.auditWriter = Objects.requireNonNull(auditWriter, "AuditWriter cannot be null");
        this.sourceFetcher = Objects.requireNonNull(sourceFetcher, "SourceFetcher cannot be null");
        this.normalizer = Objects.requireNonNull(normalizer, "PayloadNormalizer cannot be null");
        this.rowValidator = Objects.requireNonNull(rowValidator, "RowValidator cannot be null");
        this.rowWriter = Objects.requireNonNull(rowWriter, "RowWriter cannot be null");
    }

    @Override
    public RefreshOutcome refresh(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new InvalidInputException("table name required");
        }
        // The source URL is re-read every cycle so edits apply without restarting the task
        TableMetadata metadata = metadataReader.findTable(tableName)
                .orElseThrow(() -> new TableNotFoundException(tableName));
        return runCycle(tableName, metadata.getDataSourceUrl());
    }

    /**
     * Runs the stages against an explicit source URL.
     *
     * @param tableName The destination table.
     * @param sourceUrl The URL to fetch; null or blank fails the FETCH stage.
     * @return The reported outcome.
     */
    public RefreshOutcome runCycle(String tableName, String sourceUrl) {
        MDC.put(MDC_TABLE_KEY, tableName);
        long startTime = System.nanoTime();
        try {
            RefreshOutcome outcome = execute(tableName, sourceUrl);
            report(outcome);
            long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
            if (outcome.isOk()) {
                log.info("Refresh of {} OK: {} ({} ms)", tableName, outcome.getMessage(), durationMillis);
            } else {
                log.error("Refresh of {} failed: {} ({} ms)", tableName, outcome.getMessage(), durationMillis);
            }
            return outcome;
        } finally {
            MDC.remove(MDC_TABLE_KEY);
        }
    }

    private RefreshOutcome execute(String tableName, String sourceUrl) {
        // 1. Fetch
        List<Map<String, Object>> records;
        try {
            records = sourceFetcher.fetch(sourceUrl);
        } catch (RuntimeException e) {
            return failed(tableName, "Fetch failed", e);
        }
        log.debug("Fetched {} records for {}", records.size(), tableName);

        // 2. Transform
        records = normalizer.normalize(records);

        // 3. Validate
        List<Row> rows;
        try {
            rows = rowValidator.validate(tableName, records);
        } catch (RuntimeException e) {
            return failed(tableName, "Validation failed", e);
        }

        // 4. Commit
        int committed;
        try {
            committed = rowWriter.write(tableName, rows);
        } catch (RuntimeException e) {
            return failed(tableName, "Insert failed", e);
        }

        return RefreshOutcome.ok(tableName, committed);
    }

    private RefreshOutcome failed(String tableName, String stage, RuntimeException e) {
        if (e instanceof EtlProcessingException) {
            log.debug("Stage failure for {}: {}", tableName, stage, e);
        } else {
            log.error("Unexpected error in stage '{}' for {}: {}", stage, tableName, e.getMessage(), e);
        }
        return RefreshOutcome.error(tableName, stage + ": " + e.getMessage());
    }

    private void report(RefreshOutcome outcome) {
        String tableName = outcome.getTableName();
        try {
            auditWriter.append(tableName, outcome.getStatus(), outcome.getMessage());
        } catch (RuntimeException e) {
            log.warn("Could not write refresh log for {}: {}", tableName, e.getMessage());
        }
        try {
            metadataWriter.updateStatus(tableName, outcome.getStatus(), outcome.isOk() ? null : outcome.getMessage());
        } catch (RuntimeException e) {
            log.warn("Could not update refresh status for {}: {}", tableName, e.getMessage());
        }
    }
}
