package com.di.bqtarget.config;

import com.di.bqtarget.ingest.Sleeper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IngestionConfig {

    @Bean
    @ConditionalOnMissingBean(Sleeper.class)
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }
}
