package com.example.dataflow.core.processor;

import com.example.dataflow.core.exception.CoercionException;
import com.example.dataflow.core.exception.EmptyInputException;
import com.example.dataflow.core.metadata.MetadataReader;
import com.example.dataflow.core.model.ColumnCatalog;
import com.example.dataflow.core.model.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns normalized records into store-ready rows for one destination table.
 * Fields that do not name a column are dropped, the rest are coerced to the column's declared
 * type, and records left with no fields are skipped.
 */
public class RowValidator {

    private static final Logger log = LoggerFactory.getLogger(RowValidator.class);

    private final MetadataReader metadataReader;
    private final TypeCoercer typeCoercer;

    public RowValidator(MetadataReader metadataReader, TypeCoercer typeCoercer) {
        this.metadataReader = Objects.requireNonNull(metadataReader, "MetadataReader cannot be null");
        this.typeCoercer = Objects.requireNonNull(typeCoercer, "TypeCoercer cannot be null");
    }

    /**
     * Validates and converts records for the given table.
     *
     * @param tableName The destination table; must pass {@link SqlIdentifiers#requireSafe(String)}.
     * @param records   Normalized records.
     * @return The rows to insert, possibly empty if no record matched any column.
     * @throws com.example.dataflow.core.exception.InvalidIdentifierException on an unsafe table name.
     * @throws EmptyInputException  if {@code records} is empty.
     * @throws com.example.dataflow.core.exception.SchemaLoadException if the column catalog is unavailable.
     * @throws CoercionException    on the first composite value that cannot be serialized.
     */
    public List<Row> validate(String tableName, List<Map<String, Object>> records) {
        SqlIdentifiers.requireSafe(tableName);
        if (records == null || records.isEmpty()) {
            throw new EmptyInputException("no rows to validate");
        }

        ColumnCatalog catalog = metadataReader.loadColumnCatalog(tableName);

        List<Row> rows = new ArrayList<>(records.size());
        int droppedFields = 0;
        for (Map<String, Object> record : records) {
            Row.Builder row = Row.builder();
            int kept = 0;
            for (Map.Entry<String, Object> field : record.entrySet()) {
                String column = field.getKey();
                String declaredType = catalog.typeOf(column);
                if (declaredType == null) {
                    droppedFields++;
                    continue;
                }
                try {
                    row.add(column, typeCoercer.coerce(declaredType, field.getValue()));
                } catch (CoercionException e) {
                    throw new CoercionException(column, e.getMessage(), e.getCause());
                }
                kept++;
            }
            if (kept > 0) {
                rows.add(row.build());
            }
        }

        log.debug("Validated {} of {} records for table {} ({} unknown fields dropped)",
                  rows.size(), records.size(), tableName, droppedFields);
        return rows;
    }
}
