package com.di.bqtarget.ingest;

import com.di.bqtarget.config.TargetProperties;
import com.di.bqtarget.exception.InsertFailureException;
import com.di.bqtarget.exception.TargetException;
import com.di.bqtarget.record.RecordEncoder;
import com.di.bqtarget.schema.ColumnDefinition;
import com.di.bqtarget.warehouse.RowError;
import com.di.bqtarget.warehouse.WarehouseClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Creates tables as soon as their schema arrives and inserts every record on its own.
 *
 * <p>Table handling on a SCHEMA event:
 * <ul>
 *   <li>absent: create it;</li>
 *   <li>present and overwrite requested: delete, recreate, then block for the configured
 *       cool-down before the first insert (streaming inserts into a freshly recreated table can
 *       be silently dropped until the table is consistent again). A table is recreated at most
 *       once per run;</li>
 *   <li>present otherwise: use as-is.</li>
 * </ul>
 *
 * <p>Insert failures are logged with the record and rethrown. Nothing is retried here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamInsertEngine implements IngestionEngine {

    private final TargetProperties properties;
    private final WarehouseClient warehouse;
    private final RecordEncoder encoder;
    private final Sleeper sleeper;

    @Override
    public String type() {
        return TargetProperties.STRATEGY_STREAMING;
    }

    @Override
    public void onSchema(TableEntry entry) {
        String table = entry.getTableName();
        List<ColumnDefinition> columns = entry.columns();

        if (!warehouse.tableExists(table)) {
            log.info("[SCHEMA] creating table {}", table);
            warehouse.createTable(table, columns);
            return;
        }

        if (properties.isOverwrite(table) && !entry.isRecreated()) {
            log.info("[SCHEMA] recreating table {} for FULL_TABLE replication", table);
            warehouse.deleteTable(table);
            warehouse.createTable(table, columns);
            entry.setRecreated(true);
            coolDown(table);
            return;
        }

        log.info("[SCHEMA] table {} exists, appending", table);
    }

    @Override
    public void onRecord(TableEntry entry, JsonNode projectedRecord) {
        String table = entry.getTableName();
        Map<String, Object> row = encoder.toRowContent(projectedRecord);

        List<RowError> errors;
        try {
            errors = warehouse.insertRows(table, List.of(row));
        } catch (TargetException e) {
            log.error("[INSERT] Failed to insert rows for {}: {}\n{}", table, e.getMessage(), row);
            throw e;
        } catch (RuntimeException e) {
            log.error("[INSERT] Failed to insert rows for {}: {}\n{}", table, e.getMessage(), row);
            throw new InsertFailureException(table, e);
        }

        if (errors != null && !errors.isEmpty()) {
            entry.recordErrors(1);
            log.error("[INSERT] Failed to insert rows for {}:\n{}\n{}", table, row, RowError.describe(errors));
            throw new InsertFailureException(table, errors);
        }
        entry.recordAccepted(1);
    }

    @Override
    public boolean finish(Collection<TableEntry> entries) {
        boolean clean = true;
        for (TableEntry entry : entries) {
            if (entry.getErrorRows() == 0) {
                log.info("[INSERT] Loaded {} row(s) into {}:{}",
                        entry.getAcceptedRows(), properties.getDatasetId(), entry.getTableName());
            } else {
                clean = false;
                log.error("[INSERT] {} row(s) failed for {}", entry.getErrorRows(), entry.getTableName());
            }
        }
        return clean;
    }

    private void coolDown(String table) {
        Duration cooldown = properties.getStreamingCooldown();
        if (cooldown == null || cooldown.isZero() || cooldown.isNegative()) {
            return;
        }
        log.warn("[SCHEMA] waiting {} before streaming into recreated table {}", cooldown, table);
        try {
            sleeper.sleep(cooldown);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TargetException("Interrupted while waiting for recreated table " + table, e);
        }
    }
}
