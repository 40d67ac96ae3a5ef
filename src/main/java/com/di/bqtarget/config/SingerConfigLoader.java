package com.di.bqtarget.config;

import com.di.bqtarget.exception.TargetConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Applies a Singer JSON config file over the Spring-bound {@link TargetProperties}.
 *
 * <p>Accepted forms: {@code --config file.json}, {@code --config=file.json}, {@code -c file.json}.
 * Without any of them the bound properties are used unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SingerConfigLoader {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ApplicationArguments arguments;
    private final TargetProperties properties;

    /** Applies the config file named on the command line, if any, to the shared properties bean. */
    public void apply() {
        apply(arguments.getSourceArgs(), properties);
    }

    public void apply(String[] args, TargetProperties target) {
        Optional<Path> path = configPath(args);
        if (path.isEmpty()) {
            log.debug("No --config argument; using bound bqtarget.* properties");
            return;
        }
        log.info("[TARGET] reading config from {}", path.get());
        applyTo(read(path.get()), target);
    }

    static Optional<Path> configPath(String[] args) {
        if (args == null) {
            return Optional.empty();
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--config=")) {
                return Optional.of(Path.of(arg.substring("--config=".length())));
            }
            if (("--config".equals(arg) || "-c".equals(arg)) && i + 1 < args.length) {
                return Optional.of(Path.of(args[i + 1]));
            }
        }
        return Optional.empty();
    }

    public SingerConfig read(Path path) {
        if (!Files.isReadable(path)) {
            throw new TargetConfigurationException("Config file not found or not readable: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            SingerConfig config = JSON_MAPPER.readValue(in, SingerConfig.class);
            if (config == null) {
                throw new TargetConfigurationException("Config file is empty: " + path);
            }
            return config;
        } catch (IOException e) {
            throw new TargetConfigurationException("Failed to read config file " + path + ": " + e.getMessage(), e);
        }
    }

    public static void applyTo(SingerConfig config, TargetProperties target) {
        if (config.getProjectId() != null) target.setProjectId(config.getProjectId());
        if (config.getDatasetId() != null) target.setDatasetId(config.getDatasetId());
        if (config.getLocation() != null) target.setLocation(config.getLocation());
        if (config.getStreamData() != null) target.setStreamData(config.getStreamData());
        if (config.getReplicationMethod() != null) target.setReplicationMethod(config.getReplicationMethod());
        if (config.getForcedFulltables() != null) target.setForcedFulltables(new ArrayList<>(config.getForcedFulltables()));
        if (config.getTablePrefix() != null) target.setTablePrefix(config.getTablePrefix());
        if (config.getTableSuffix() != null) target.setTableSuffix(config.getTableSuffix());
        if (config.getValidateRecords() != null) target.setValidateRecords(config.getValidateRecords());
    }
}
