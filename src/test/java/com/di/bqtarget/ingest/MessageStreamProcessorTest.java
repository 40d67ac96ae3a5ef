package com.di.bqtarget.ingest;

import com.di.bqtarget.config.TargetProperties;
import com.di.bqtarget.exception.LoadFailureException;
import com.di.bqtarget.exception.MessageParseException;
import com.di.bqtarget.exception.RecordValidationException;
import com.di.bqtarget.exception.SchemaNotFoundException;
import com.di.bqtarget.message.MessageParser;
import com.di.bqtarget.record.JsonSchemaRecordValidator;
import com.di.bqtarget.record.RecordEncoder;
import com.di.bqtarget.record.RecordValidator;
import com.di.bqtarget.schema.ColumnDefinition;
import com.di.bqtarget.schema.ColumnMode;
import com.di.bqtarget.warehouse.InMemoryWarehouseClient;
import com.di.bqtarget.warehouse.RowError;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MessageStreamProcessor Tests")
class MessageStreamProcessorTest {

    private static final String USERS_SCHEMA =
            "{\"type\":\"SCHEMA\",\"stream\":\"users\",\"schema\":{\"type\":\"object\",\"required\":[\"id\"],"
                    + "\"properties\":{\"id\":{\"type\":\"integer\"},\"name\":{\"type\":\"string\"}}},\"key_properties\":[]}";

    private TargetProperties properties;
    private InMemoryWarehouseClient warehouse;
    private List<JsonNode> emitted;

    @BeforeEach
    void setUp() {
        properties = new TargetProperties();
        properties.setProjectId("p");
        properties.setDatasetId("d");
        warehouse = new InMemoryWarehouseClient();
        emitted = new ArrayList<>();
    }

    private MessageStreamProcessor batchProcessor(RecordValidator validator) {
        BatchLoadEngine engine = new BatchLoadEngine(properties, warehouse, new RecordEncoder());
        return new MessageStreamProcessor(new MessageParser(), engine, validator, emitted::add, properties::tableNameFor);
    }

    private MessageStreamProcessor streamingProcessor() {
        StreamInsertEngine engine = new StreamInsertEngine(properties, warehouse, new RecordEncoder(), duration -> { });
        return new MessageStreamProcessor(new MessageParser(), engine, RecordValidator.disabled(), emitted::add,
                properties::tableNameFor);
    }

    private static BufferedReader lines(String... lines) {
        return new BufferedReader(new StringReader(String.join("\n", lines)));
    }

    @Test
    @DisplayName("Batch: should load the projected record once and emit the checkpoint after the load")
    void testBatchUsersScenario() throws Exception {
        ProcessingSummary summary = batchProcessor(new JsonSchemaRecordValidator()).process(lines(
                USERS_SCHEMA,
                "{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":{\"id\":1,\"name\":\"a\"}}",
                "{\"type\":\"STATE\",\"value\":{\"bookmark\":1}}"));

        assertEquals(1, warehouse.loads.size());
        InMemoryWarehouseClient.LoadCall load = warehouse.loads.get(0);
        assertEquals("users", load.table());
        assertEquals(List.of("{\"id\":1,\"name\":\"a\"}"), load.lines());
        assertFalse(load.truncate());
        assertEquals(List.of("id", "name"), load.schema().stream().map(ColumnDefinition::name).toList());
        assertEquals(ColumnMode.REQUIRED, load.schema().get(0).mode());
        assertEquals(ColumnMode.NULLABLE, load.schema().get(1).mode());

        assertEquals(1, emitted.size());
        assertEquals(1, emitted.get(0).get("bookmark").asInt());
        assertEquals(3, summary.lines());
        assertEquals(1, summary.records());
        assertEquals(List.of("users"), summary.tables());
        assertTrue(summary.checkpointEmitted());
    }

    @Test
    @DisplayName("Should not emit a checkpoint that was followed by a record")
    void testStaleCheckpoint() throws Exception {
        ProcessingSummary summary = batchProcessor(RecordValidator.disabled()).process(lines(
                USERS_SCHEMA,
                "{\"type\":\"STATE\",\"value\":{\"bookmark\":1}}",
                "{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":{\"id\":1}}"));

        assertTrue(emitted.isEmpty());
        assertFalse(summary.checkpointEmitted());
        assertEquals(1, warehouse.loads.size());
    }

    @Test
    @DisplayName("Should emit only the latest of several checkpoints")
    void testLatestCheckpointWins() throws Exception {
        batchProcessor(RecordValidator.disabled()).process(lines(
                USERS_SCHEMA,
                "{\"type\":\"STATE\",\"value\":{\"bookmark\":1}}",
                "{\"type\":\"STATE\",\"value\":{\"bookmark\":2}}"));

        assertEquals(1, emitted.size());
        assertEquals(2, emitted.get(0).get("bookmark").asInt());
    }

    @Test
    @DisplayName("Should fail on a record whose stream has no schema yet")
    void testRecordBeforeSchema() {
        MessageStreamProcessor processor = batchProcessor(RecordValidator.disabled());

        SchemaNotFoundException ex = assertThrows(SchemaNotFoundException.class, () -> processor.process(lines(
                "{\"type\":\"RECORD\",\"stream\":\"orders\",\"record\":{\"id\":1}}")));
        assertEquals("orders", ex.getTableName());
        assertTrue(warehouse.loads.isEmpty());
    }

    @Test
    @DisplayName("Should stop on the first record that fails validation")
    void testValidationFailure() {
        MessageStreamProcessor processor = batchProcessor(new JsonSchemaRecordValidator());

        assertThrows(RecordValidationException.class, () -> processor.process(lines(
                USERS_SCHEMA,
                "{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":{\"id\":\"x\"}}",
                "{\"type\":\"STATE\",\"value\":{\"bookmark\":1}}")));
        assertTrue(warehouse.loads.isEmpty());
        assertTrue(emitted.isEmpty());
    }

    @Test
    @DisplayName("Should fail on malformed input with the line number")
    void testMalformedLine() {
        MessageStreamProcessor processor = batchProcessor(RecordValidator.disabled());

        MessageParseException ex = assertThrows(MessageParseException.class,
                () -> processor.process(lines(USERS_SCHEMA, "", "garbage")));
        assertEquals(3, ex.getLineNumber());
    }

    @Test
    @DisplayName("Batch: should keep the first schema and one spool when a stream re-declares its schema")
    void testBatchKeepsFirstSchema() throws Exception {
        batchProcessor(RecordValidator.disabled()).process(lines(
                USERS_SCHEMA,
                "{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":{\"id\":1}}",
                "{\"type\":\"SCHEMA\",\"stream\":\"users\",\"schema\":{\"type\":\"object\",\"properties\":{\"email\":{\"type\":\"string\"}}}}",
                "{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":{\"id\":2,\"email\":\"b@x\"}}"));

        assertEquals(1, warehouse.loads.size());
        InMemoryWarehouseClient.LoadCall load = warehouse.loads.get(0);
        assertEquals(List.of("{\"id\":1}", "{\"id\":2}"), load.lines());
        assertEquals("id", load.schema().get(0).name());
    }

    @Test
    @DisplayName("Batch: should load tables in registration order and apply prefix and suffix")
    void testBatchOrderAndNaming() throws Exception {
        properties.setTablePrefix("raw_");
        properties.setTableSuffix("_v1");

        batchProcessor(RecordValidator.disabled()).process(lines(
                "{\"type\":\"SCHEMA\",\"stream\":\"orders\",\"schema\":{\"type\":\"object\",\"properties\":{\"id\":{\"type\":\"integer\"}}}}",
                USERS_SCHEMA,
                "{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":{\"id\":1}}"));

        assertEquals(List.of("raw_orders_v1", "raw_users_v1"),
                warehouse.loads.stream().map(InMemoryWarehouseClient.LoadCall::table).toList());
        assertTrue(warehouse.loads.get(0).lines().isEmpty());
    }

    @Test
    @DisplayName("Batch: should not emit the checkpoint when a load fails")
    void testBatchLoadFailure() {
        warehouse.nextLoadErrors = List.of(new RowError(0, "invalid", "bad row"));
        MessageStreamProcessor processor = batchProcessor(RecordValidator.disabled());

        assertThrows(LoadFailureException.class, () -> processor.process(lines(
                USERS_SCHEMA,
                "{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":{\"id\":1}}",
                "{\"type\":\"STATE\",\"value\":{\"bookmark\":1}}")));
        assertTrue(emitted.isEmpty());
    }

    @Test
    @DisplayName("Streaming: should create the table, insert each record and emit the checkpoint at the end")
    void testStreaming() throws Exception {
        ProcessingSummary summary = streamingProcessor().process(lines(
                USERS_SCHEMA,
                "{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":{\"id\":1,\"extra\":true}}",
                "{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":{\"id\":2}}",
                "{\"type\":\"STATE\",\"value\":{\"bookmark\":2}}",
                "{\"type\":\"ACTIVATE_VERSION\",\"stream\":\"users\",\"version\":1}"));

        assertEquals(List.of("tableExists:users", "createTable:users", "insert:users", "insert:users"), warehouse.calls);
        assertEquals(List.of("id"), List.copyOf(warehouse.inserts.get(0).rows().get(0).keySet()));
        assertEquals(1, emitted.size());
        assertEquals(2, summary.records());
        assertTrue(warehouse.loads.isEmpty());
    }

    @Test
    @DisplayName("Streaming: should apply a re-declared schema")
    void testStreamingReplacesSchema() throws Exception {
        streamingProcessor().process(lines(
                USERS_SCHEMA,
                "{\"type\":\"SCHEMA\",\"stream\":\"users\",\"schema\":{\"type\":\"object\",\"properties\":{\"id\":{\"type\":\"integer\"},\"email\":{\"type\":\"string\"}}}}",
                "{\"type\":\"RECORD\",\"stream\":\"users\",\"record\":{\"id\":1,\"name\":\"a\",\"email\":\"a@x\"}}"));

        assertEquals(List.of("id", "email"), List.copyOf(warehouse.inserts.get(0).rows().get(0).keySet()));
    }
}
