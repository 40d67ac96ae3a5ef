package com.di.bqtarget.warehouse;

import com.di.bqtarget.config.TargetProperties;
import com.di.bqtarget.schema.ColumnDefinition;
import com.google.cloud.RetryOption;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.DatasetInfo;
import com.google.cloud.bigquery.FormatOptions;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.JobStatistics;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableDataWriteChannel;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableInfo;
import com.google.cloud.bigquery.WriteChannelConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;
import org.threeten.bp.Duration;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link WarehouseClient} backed by the BigQuery Java client.
 *
 * <p>Loads go through a {@link TableDataWriteChannel} (newline-delimited JSON, explicit schema,
 * no autodetect) and block until the job finishes, capped by {@code bqtarget.load-timeout}.
 * Inserts use {@code insertAll}.
 */
@Slf4j
@Component
public class BigQueryWarehouseClient implements WarehouseClient {

    private static final int HTTP_CONFLICT = 409;

    private final BigQuery bigQuery;
    private final TargetProperties properties;

    public BigQueryWarehouseClient(@Lazy BigQuery bigQuery, TargetProperties properties) {
        this.bigQuery = bigQuery;
        this.properties = properties;
    }

    @Override
    public void createDatasetIfAbsent() {
        DatasetId datasetId = datasetId();
        if (bigQuery.getDataset(datasetId) != null) {
            log.info("[TARGET] dataset {}.{} exists", datasetId.getProject(), datasetId.getDataset());
            return;
        }
        log.info("[TARGET] Attempting to create dataset: {}.{} in location: {}",
                datasetId.getProject(), datasetId.getDataset(), properties.getLocation());
        try {
            bigQuery.create(DatasetInfo.newBuilder(datasetId).setLocation(properties.getLocation()).build());
            log.info("[TARGET] Successfully created dataset: {}.{}", datasetId.getProject(), datasetId.getDataset());
        } catch (BigQueryException e) {
            if (e.getCode() != HTTP_CONFLICT) {
                throw e;
            }
            log.info("[TARGET] dataset {} was created concurrently", datasetId.getDataset());
        }
    }

    @Override
    public boolean datasetExists() {
        return bigQuery.getDataset(datasetId()) != null;
    }

    @Override
    public boolean tableExists(String tableName) {
        Table table = bigQuery.getTable(tableId(tableName));
        return table != null && table.exists();
    }

    @Override
    public void createTable(String tableName, List<ColumnDefinition> schema) {
        TableInfo info = TableInfo.of(tableId(tableName), StandardTableDefinition.of(BigQuerySchemaMapper.toSchema(schema)));
        try {
            bigQuery.create(info);
        } catch (BigQueryException e) {
            if (e.getCode() != HTTP_CONFLICT) {
                throw e;
            }
            log.info("[SCHEMA] table {} already exists", tableName);
        }
    }

    @Override
    public boolean deleteTable(String tableName) {
        return bigQuery.delete(tableId(tableName));
    }

    @Override
    public LoadOutcome loadFromFile(String tableName, List<ColumnDefinition> schema, Path source, boolean truncate) {
        WriteChannelConfiguration config = WriteChannelConfiguration.newBuilder(tableId(tableName))
                .setFormatOptions(FormatOptions.json())
                .setSchema(BigQuerySchemaMapper.toSchema(schema))
                .setCreateDisposition(JobInfo.CreateDisposition.CREATE_IF_NEEDED)
                .setWriteDisposition(truncate
                        ? JobInfo.WriteDisposition.WRITE_TRUNCATE
                        : JobInfo.WriteDisposition.WRITE_APPEND)
                .setIgnoreUnknownValues(false)
                .setMaxBadRecords(0)
                .build();

        String jobName = "bqtarget-load-" + tableName + "-" + UUID.randomUUID();
        JobId jobId = JobId.newBuilder()
                .setJob(jobName)
                .setProject(properties.getProjectId())
                .setLocation(properties.getLocation())
                .build();

        TableDataWriteChannel writer = bigQuery.writer(jobId, config);
        try (OutputStream stream = Channels.newOutputStream(writer)) {
            Files.copy(source, stream);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot upload " + source + " for table " + tableName, e);
        }
        log.info("[LOAD] loading job {}", jobName);

        Job job = writer.getJob();
        try {
            job = job.waitFor(RetryOption.totalTimeout(Duration.ofMillis(properties.getLoadTimeout().toMillis())));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for load job " + jobName, e);
        }

        if (job == null) {
            return LoadOutcome.builder()
                    .jobId(jobName)
                    .errors(List.of(RowError.jobLevel("timeout", "load job timed out or no longer exists")))
                    .build();
        }
        if (job.getStatus().getError() != null) {
            return LoadOutcome.builder()
                    .jobId(jobName)
                    .errors(toRowErrors(job.getStatus().getError(), job.getStatus().getExecutionErrors()))
                    .build();
        }

        JobStatistics.LoadStatistics stats = job.getStatistics();
        long outputRows = stats != null && stats.getOutputRows() != null ? stats.getOutputRows() : 0L;
        return LoadOutcome.builder().jobId(jobName).outputRows(outputRows).build();
    }

    @Override
    public List<RowError> insertRows(String tableName, List<Map<String, Object>> rows) {
        InsertAllRequest.Builder request = InsertAllRequest.newBuilder(tableId(tableName));
        rows.forEach(request::addRow);
        InsertAllResponse response = bigQuery.insertAll(request.build());
        if (!response.hasErrors()) {
            return List.of();
        }
        List<RowError> errors = new ArrayList<>();
        for (Map.Entry<Long, List<BigQueryError>> e : response.getInsertErrors().entrySet()) {
            for (BigQueryError error : e.getValue()) {
                errors.add(new RowError(e.getKey(), error.getReason(), error.getMessage()));
            }
        }
        return errors;
    }

    private static List<RowError> toRowErrors(BigQueryError error, List<BigQueryError> executionErrors) {
        List<RowError> out = new ArrayList<>();
        if (executionErrors != null) {
            executionErrors.forEach(e -> out.add(RowError.jobLevel(e.getReason(), e.getMessage())));
        }
        if (out.isEmpty()) {
            out.add(RowError.jobLevel(error.getReason(), error.getMessage()));
        }
        return out;
    }

    private DatasetId datasetId() {
        return DatasetId.of(properties.getProjectId(), properties.getDatasetId());
    }

    private TableId tableId(String tableName) {
        return TableId.of(properties.getProjectId(), properties.getDatasetId(), tableName);
    }
}
