package com.di.bqtarget.runner;

import com.di.bqtarget.config.SingerConfigLoader;
import com.di.bqtarget.config.TargetProperties;
import com.di.bqtarget.exception.TargetConfigurationException;
import com.di.bqtarget.exception.UnsupportedConfigurationException;
import com.di.bqtarget.ingest.BatchLoadEngine;
import com.di.bqtarget.ingest.IngestionEngineRegistry;
import com.di.bqtarget.ingest.ProcessingSummary;
import com.di.bqtarget.ingest.StreamInsertEngine;
import com.di.bqtarget.message.MessageParser;
import com.di.bqtarget.record.RecordEncoder;
import com.di.bqtarget.warehouse.InMemoryWarehouseClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TargetRunner Tests")
class TargetRunnerTest {

    private static final String USERS_INPUT = String.join("\n",
            "{\"type\":\"SCHEMA\",\"stream\":\"users\",\"schema\":{\"type\":\"object\",\"properties\":{\"id\":{\"type\":\"integer\"}}},\"key_properties\":[\"id\"]}",
            "{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":{\"id\":1,\"name\":\"a\"}}",
            "{\"type\":\"STATE\",\"value\":{\"bookmark\":1}}");

    @TempDir
    Path tempDir;

    private TargetProperties properties;
    private InMemoryWarehouseClient warehouse;
    private List<JsonNode> emitted;

    @BeforeEach
    void setUp() {
        properties = new TargetProperties();
        properties.setProjectId("test-project");
        properties.setDatasetId("test_dataset");
        properties.setStreamingCooldown(java.time.Duration.ZERO);
        warehouse = new InMemoryWarehouseClient();
        emitted = new ArrayList<>();
    }

    private TargetRunner runner(String... args) {
        RecordEncoder encoder = new RecordEncoder();
        IngestionEngineRegistry registry = new IngestionEngineRegistry(List.of(
                new BatchLoadEngine(properties, warehouse, encoder),
                new StreamInsertEngine(properties, warehouse, encoder, duration -> { })));
        registry.initialize();
        SingerConfigLoader loader = new SingerConfigLoader(new DefaultApplicationArguments(args), properties);
        return new TargetRunner(loader, properties, warehouse, registry, new MessageParser(), emitted::add);
    }

    private static InputStream input(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    /** Fails the test if anything reads from it. */
    private static InputStream untouchable() {
        return new InputStream() {
            @Override
            public int read() {
                throw new AssertionError("input must not be read");
            }
        };
    }

    @Test
    @DisplayName("Should run a batch load from a Singer config file")
    void testBatchRunFromConfigFile() throws Exception {
        Path config = tempDir.resolve("config.json");
        Files.writeString(config, "{\"stream_data\":false,\"replication_method\":\"FULL_TABLE\"}");

        ProcessingSummary summary = runner("--config", config.toString()).run(input(USERS_INPUT));

        assertEquals(List.of("createDatasetIfAbsent", "load:users"), warehouse.calls);
        assertTrue(warehouse.loads.get(0).truncate());
        assertEquals(List.of("{\"id\":1}"), warehouse.loads.get(0).lines());
        assertEquals(1, emitted.size());
        assertTrue(summary.checkpointEmitted());
    }

    @Test
    @DisplayName("Should stream by default")
    void testStreamingRun() throws Exception {
        runner().run(input(USERS_INPUT));

        assertEquals(List.of("createDatasetIfAbsent", "tableExists:users", "createTable:users", "insert:users"),
                warehouse.calls);
        assertEquals(1, emitted.size());
    }

    @Test
    @DisplayName("Should refuse streaming with FULL_TABLE before reading any input")
    void testStreamingWithTruncate() {
        properties.setReplicationMethod("FULL_TABLE");
        TargetRunner runner = runner();

        assertThrows(UnsupportedConfigurationException.class, () -> runner.run(untouchable()));
        assertTrue(warehouse.calls.isEmpty());
    }

    @Test
    @DisplayName("Should fail without project or dataset")
    void testMissingRequiredConfig() {
        properties.setProjectId(null);
        TargetRunner runner = runner();
        TargetConfigurationException ex = assertThrows(TargetConfigurationException.class, () -> runner.run(untouchable()));
        assertTrue(ex.getMessage().contains("project_id"));

        properties.setProjectId("p");
        properties.setDatasetId(" ");
        assertThrows(TargetConfigurationException.class, runner::checkConfiguration);
    }

    @Test
    @DisplayName("Should continue when the dataset cannot be created")
    void testDatasetCreationFailure() throws Exception {
        warehouse.failDatasetCreation = new IllegalStateException("permission denied");

        ProcessingSummary summary = runner().run(input(USERS_INPUT));

        assertEquals(1, summary.records());
        assertEquals(1, warehouse.inserts.size());
    }
}
