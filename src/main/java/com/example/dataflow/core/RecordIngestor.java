package com.example.dataflow.core;

import com.example.dataflow.core.exception.InvalidInputException;
import com.example.dataflow.core.exception.TableNotFoundException;
import com.example.dataflow.core.metadata.MetadataReader;
import com.example.dataflow.core.model.Row;
import com.example.dataflow.core.processor.PayloadNormalizer;
import com.example.dataflow.core.processor.RowValidator;
import com.example.dataflow.core.reader.JsonRecordDecoder;
import com.example.dataflow.core.writer.RowWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads a caller-supplied JSON document into a registered table through the same TRANSFORM,
 * VALIDATE and COMMIT stages as a refresh cycle. Unlike a refresh it fetches nothing, writes no
 * audit entry and leaves the table's status untouched; failures propagate to the caller.
 */
public class RecordIngestor {

    private static final Logger log = LoggerFactory.getLogger(RecordIngestor.class);

    private final MetadataReader metadataReader;
    private final JsonRecordDecoder decoder;
    private final PayloadNormalizer normalizer;
    private final RowValidator rowValidator;
    private final RowWriter rowWriter;

    public RecordIngestor(MetadataReader metadataReader,
                          JsonRecordDecoder decoder,
                          PayloadNormalizer normalizer,
                          RowValidator rowValidator,
                          RowWriter rowWriter) {
        this.metadataReader = Objects.requireNonNull(metadataReader, "MetadataReader cannot be null");
        this.decoder = Objects.requireNonNull(decoder, "JsonRecordDecoder cannot be null");
        this.normalizer = Objects.requireNonNull(normalizer, "PayloadNormalizer cannot be null");
        this.rowValidator = Objects.requireNonNull(rowValidator, "RowValidator cannot be null");
        this.rowWriter = Objects.requireNonNull(rowWriter, "RowWriter cannot be null");
    }

    /**
     * @param tableName A table registered in the metadata store.
     * @param body      A JSON object or an array of objects.
     * @return Number of rows committed.
     * @throws TableNotFoundException if the table is not registered.
     * @throws com.example.dataflow.core.exception.SourceShapeException if the body is not an object or array of objects.
     * @throws com.example.dataflow.core.exception.EmptyInputException if the body holds no records.
     */
    public int ingest(String tableName, String body) {
        if (tableName == null || tableName.isBlank()) {
            throw new InvalidInputException("table name required");
        }
        metadataReader.findTable(tableName).orElseThrow(() -> new TableNotFoundException(tableName));
        if (body == null || body.isBlank()) {
            throw new InvalidInputException("request body is empty");
        }

        List<Map<String, Object>> records = normalizer.normalize(decoder.decode(body));
        List<Row> rows = rowValidator.validate(tableName, records);
        int committed = rowWriter.write(tableName, rows);
        log.info("Ingested {} rows into {}", committed, tableName);
        return committed;
    }
}
