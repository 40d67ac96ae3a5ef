package com.di.bqtarget.ingest;

import com.di.bqtarget.config.TargetProperties;
import com.di.bqtarget.exception.LoadFailureException;
import com.di.bqtarget.exception.TargetException;
import com.di.bqtarget.record.RecordEncoder;
import com.di.bqtarget.schema.ColumnDefinition;
import com.di.bqtarget.warehouse.LoadOutcome;
import com.di.bqtarget.warehouse.RowError;
import com.di.bqtarget.warehouse.WarehouseClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Spools every record of a table to a local file and loads each file with one load job after
 * the input ends. Overwrite is atomic here: the WRITE_TRUNCATE load replaces the table in one job.
 *
 * <h3>Per table, in registration order</h3>
 * <ol>
 *   <li>Translate the stream schema (key properties become REQUIRED).</li>
 *   <li>Pick WRITE_TRUNCATE for FULL_TABLE replication or a forced full table, WRITE_APPEND otherwise.</li>
 *   <li>Load the spool and wait for the job; any reported error aborts the remaining loads.</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchLoadEngine implements IngestionEngine {

    private final TargetProperties properties;
    private final WarehouseClient warehouse;
    private final RecordEncoder encoder;

    @Override
    public String type() {
        return TargetProperties.STRATEGY_BATCH;
    }

    @Override
    public boolean keepsFirstSchema() {
        return true;
    }

    @Override
    public void onSchema(TableEntry entry) {
        entry.setSpool(RecordSpool.create(entry.getTableName()));
    }

    @Override
    public void onRecord(TableEntry entry, JsonNode projectedRecord) {
        entry.getSpool().append(encoder.encodeLine(projectedRecord));
    }

    @Override
    public boolean finish(Collection<TableEntry> entries) {
        for (TableEntry entry : entries) {
            load(entry);
        }
        return true;
    }

    private void load(TableEntry entry) {
        String table = entry.getTableName();
        List<ColumnDefinition> columns = entry.columns();
        boolean truncate = properties.isOverwrite(table);
        if (truncate) {
            log.info("[LOAD] Load {} by FULL_TABLE", table);
        }

        RecordSpool spool = entry.getSpool();
        Path file = spool.seal();
        log.info("[LOAD] loading {} ({} spooled records) to BigQuery", table, spool.getLineCount());

        LoadOutcome outcome;
        try {
            outcome = warehouse.loadFromFile(table, columns, file, truncate);
        } catch (TargetException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[LOAD] failed to load table {} from file: {}", table, e.getMessage());
            throw new LoadFailureException(table, e);
        }

        if (!outcome.isSuccessful()) {
            log.error("[LOAD] failed to load table {} from file, job {}, errors:\n{}",
                    table, outcome.getJobId(), RowError.describe(outcome.getErrors()));
            throw new LoadFailureException(table, outcome.getErrors());
        }

        entry.recordAccepted(outcome.getOutputRows());
        log.info("[LOAD] Loaded {} rows in {} (job {})", outcome.getOutputRows(), table, outcome.getJobId());
        spool.close();
    }
}
