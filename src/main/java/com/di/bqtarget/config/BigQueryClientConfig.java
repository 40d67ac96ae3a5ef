package com.di.bqtarget.config;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Registers a BigQuery client bean backed by Application Default Credentials.
 *
 * <p>Lazy so that a Singer {@code --config} file is applied to {@link TargetProperties} before
 * the client reads the project and location.
 */
@Configuration
public class BigQueryClientConfig {

    @Bean
    @Lazy
    @ConditionalOnMissingBean(BigQuery.class)
    public BigQuery bigQueryClient(TargetProperties properties) {
        BigQueryOptions.Builder options = BigQueryOptions.newBuilder();
        if (properties.getProjectId() != null && !properties.getProjectId().isBlank()) {
            options.setProjectId(properties.getProjectId());
        }
        if (properties.getLocation() != null && !properties.getLocation().isBlank()) {
            options.setLocation(properties.getLocation());
        }
        return options.build().getService();
    }
}
