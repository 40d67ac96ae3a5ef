package com.di.bqtarget.runner;

import com.di.bqtarget.checkpoint.CheckpointSink;
import com.di.bqtarget.config.SingerConfigLoader;
import com.di.bqtarget.config.TargetProperties;
import com.di.bqtarget.exception.TargetConfigurationException;
import com.di.bqtarget.exception.UnsupportedConfigurationException;
import com.di.bqtarget.ingest.IngestionEngine;
import com.di.bqtarget.ingest.IngestionEngineRegistry;
import com.di.bqtarget.ingest.MessageStreamProcessor;
import com.di.bqtarget.ingest.ProcessingSummary;
import com.di.bqtarget.message.MessageParser;
import com.di.bqtarget.record.JsonSchemaRecordValidator;
import com.di.bqtarget.record.RecordValidator;
import com.di.bqtarget.warehouse.WarehouseClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * One run of the target: check configuration, make sure the dataset exists, then consume the
 * Singer stream with the configured ingestion strategy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TargetRunner {

    private final SingerConfigLoader configLoader;
    private final TargetProperties properties;
    private final WarehouseClient warehouse;
    private final IngestionEngineRegistry engines;
    private final MessageParser parser;
    private final CheckpointSink checkpointSink;

    public ProcessingSummary run(InputStream input) throws IOException {
        MDC.put("runId", "run-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            configLoader.apply();
            checkConfiguration();

            log.info("[TARGET] BigQuery target configured to move data to {}.{}. table_prefix={}, table_suffix={}, "
                            + "strategy={}, location={}, validate_records={}, replication_method={}, forced_fulltables={}",
                    properties.getProjectId(), properties.getDatasetId(), properties.getTablePrefix(),
                    properties.getTableSuffix(), properties.getStrategy(), properties.getLocation(),
                    properties.isValidateRecords(), properties.getReplicationMethod(), properties.getForcedFulltables());

            ensureDataset();

            IngestionEngine engine = engines.getEngine(properties.getStrategy());
            RecordValidator validator = properties.isValidateRecords()
                    ? new JsonSchemaRecordValidator()
                    : RecordValidator.disabled();
            MessageStreamProcessor processor = new MessageStreamProcessor(
                    parser, engine, validator, checkpointSink, properties::tableNameFor);

            BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
            ProcessingSummary summary = processor.process(reader);
            log.info("[TARGET] done: {} record(s) into {} table(s), checkpoint emitted={}",
                    summary.records(), summary.tables().size(), summary.checkpointEmitted());
            return summary;
        } finally {
            MDC.remove("runId");
        }
    }

    /** Fails before any input is read. */
    void checkConfiguration() {
        if (isBlank(properties.getProjectId())) {
            throw new TargetConfigurationException("Config is missing required key 'project_id'");
        }
        if (isBlank(properties.getDatasetId())) {
            throw new TargetConfigurationException("Config is missing required key 'dataset_id'");
        }
        if (properties.isStreamData() && properties.isTruncate()) {
            throw new UnsupportedConfigurationException(
                    "Streaming data and truncating table is currently not implemented. "
                            + "Use stream_data=false for FULL_TABLE replication.");
        }
    }

    /** Best effort: a missing permission here surfaces again on the first table operation. */
    private void ensureDataset() {
        try {
            warehouse.createDatasetIfAbsent();
        } catch (RuntimeException e) {
            log.warn("[TARGET] could not create dataset {}.{}, continuing: {}",
                    properties.getProjectId(), properties.getDatasetId(), e.getMessage());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
