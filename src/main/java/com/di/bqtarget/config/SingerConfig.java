package com.di.bqtarget.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Singer-style JSON config file ({@code target-bigquery --config config.json}).
 * Every field is optional here; absent fields leave the bound {@link TargetProperties} value alone.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SingerConfig {

    @JsonProperty("project_id")
    private String projectId;

    @JsonProperty("dataset_id")
    private String datasetId;

    private String location;

    @JsonProperty("stream_data")
    private Boolean streamData;

    @JsonProperty("replication_method")
    private String replicationMethod;

    @JsonProperty("forced_fulltables")
    private List<String> forcedFulltables;

    @JsonProperty("table_prefix")
    private String tablePrefix;

    @JsonProperty("table_suffix")
    private String tableSuffix;

    @JsonProperty("validate_records")
    private Boolean validateRecords;
}
