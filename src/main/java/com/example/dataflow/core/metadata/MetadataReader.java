package com.example.dataflow.core.metadata;

import com.example.dataflow.core.exception.SchemaLoadException;
import com.example.dataflow.core.model.ColumnCatalog;
import com.example.dataflow.core.model.JobSpec;
import com.example.dataflow.core.model.TableMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Read access to registered tables and their column catalogs.
 */
public interface MetadataReader {

    /**
     * Returns the desired periodic refresh jobs: one per table that is currently eligible
     * (periodic type, positive interval, non-blank source URL).
     *
     * @return The eligible job specs; empty if no table qualifies.
     */
    List<JobSpec> findRefreshJobs();

    /**
     * Looks up a single registered table.
     *
     * @param tableName The table name.
     * @return The metadata, or empty if the table is not registered.
     */
    Optional<TableMetadata> findTable(String tableName);

    /**
     * Loads the column catalog (name to declared type) of a destination table.
     *
     * @param tableName A validated table identifier.
     * @return The catalog of the table.
     * @throws SchemaLoadException if the catalog cannot be read or the table has no columns.
     */
    ColumnCatalog loadColumnCatalog(String tableName);
}
