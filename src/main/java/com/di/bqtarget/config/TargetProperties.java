package com.di.bqtarget.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Single binding for all target configuration.
 *
 * <pre>
 * bqtarget:
 *   project-id: my-project
 *   dataset-id: raw_singer
 *   location: EU
 *   stream-data: false
 *   replication-method: FULL_TABLE
 *   forced-fulltables: [customers]
 *   table-prefix: ""
 *   table-suffix: ""
 *   validate-records: true
 *   streaming-cooldown: 5m
 *   load-timeout: 4h
 * </pre>
 *
 * <p>A Singer JSON config passed with {@code --config} is applied on top, see {@link SingerConfigLoader}.
 */
@Data
@ConfigurationProperties(prefix = "bqtarget")
public class TargetProperties {

    public static final String STRATEGY_BATCH = "batch";
    public static final String STRATEGY_STREAMING = "streaming";

    private static final String FULL_TABLE = "FULL_TABLE";

    /** BigQuery project that owns the dataset (and is billed for jobs). */
    private String projectId;

    /** Destination dataset. Created at startup when absent. */
    private String datasetId;

    /** Dataset / job location. */
    private String location = "EU";

    /** {@code true}: streaming inserts per record. {@code false}: one load job per table at end of input. */
    private boolean streamData = true;

    /** {@code FULL_TABLE} overwrites every table; anything else appends. */
    private String replicationMethod;

    /** Tables overwritten on load regardless of {@link #replicationMethod}. */
    private List<String> forcedFulltables = new ArrayList<>();

    private String tablePrefix = "";

    private String tableSuffix = "";

    /** Validate every record against its stream's JSON schema before projection. */
    private boolean validateRecords = true;

    /** Wait after dropping and recreating a table before the first streaming insert into it. */
    private Duration streamingCooldown = Duration.ofMinutes(5);

    /** Maximum wait for a single load job. */
    private Duration loadTimeout = Duration.ofHours(4);

    /** Global overwrite requested through {@code replication_method=FULL_TABLE}. */
    public boolean isTruncate() {
        return replicationMethod != null && FULL_TABLE.equalsIgnoreCase(replicationMethod.trim());
    }

    /** Whether the given table is overwritten, either globally or through {@link #forcedFulltables}. */
    public boolean isOverwrite(String tableName) {
        return isTruncate() || (forcedFulltables != null && forcedFulltables.contains(tableName));
    }

    public String getStrategy() {
        return streamData ? STRATEGY_STREAMING : STRATEGY_BATCH;
    }

    /** {@code prefix + stream + suffix}. */
    public String tableNameFor(String stream) {
        return nullToEmpty(tablePrefix) + stream + nullToEmpty(tableSuffix);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
