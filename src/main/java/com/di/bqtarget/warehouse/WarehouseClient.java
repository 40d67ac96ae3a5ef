package com.di.bqtarget.warehouse;

import com.di.bqtarget.schema.ColumnDefinition;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Operations the ingestion engines need from the warehouse. Every table name is relative to
 * the configured project and dataset.
 */
public interface WarehouseClient {

    /** Creates the configured dataset in the configured location unless it already exists. */
    void createDatasetIfAbsent();

    boolean datasetExists();

    boolean tableExists(String tableName);

    void createTable(String tableName, List<ColumnDefinition> schema);

    /** @return true when a table was deleted, false when there was none */
    boolean deleteTable(String tableName);

    /**
     * Loads a newline-delimited JSON file into the table and blocks until the job completes.
     *
     * @param truncate {@code true} replaces the table contents, {@code false} appends
     */
    LoadOutcome loadFromFile(String tableName, List<ColumnDefinition> schema, Path source, boolean truncate);

    /** @return per-row errors, empty when every row was accepted */
    List<RowError> insertRows(String tableName, List<Map<String, Object>> rows);
}
