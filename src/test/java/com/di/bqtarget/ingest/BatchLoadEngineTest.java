package com.di.bqtarget.ingest;

import com.di.bqtarget.config.TargetProperties;
import com.di.bqtarget.exception.LoadFailureException;
import com.di.bqtarget.record.RecordEncoder;
import com.di.bqtarget.schema.SchemaParser;
import com.di.bqtarget.warehouse.InMemoryWarehouseClient;
import com.di.bqtarget.warehouse.RowError;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BatchLoadEngine Tests")
class BatchLoadEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TargetProperties properties;
    private InMemoryWarehouseClient warehouse;
    private BatchLoadEngine engine;

    @BeforeEach
    void setUp() {
        properties = new TargetProperties();
        warehouse = new InMemoryWarehouseClient();
        engine = new BatchLoadEngine(properties, warehouse, new RecordEncoder());
    }

    private TableEntry registered(String table) throws Exception {
        JsonNode raw = MAPPER.readTree("{\"type\":\"object\",\"properties\":{\"id\":{\"type\":\"integer\"}}}");
        TableEntry entry = new TableEntry(table, table, raw, SchemaParser.parse(raw), List.of("id"));
        engine.onSchema(entry);
        return entry;
    }

    @Test
    @DisplayName("Should load spooled records and remove the spool file")
    void testLoad() throws Exception {
        TableEntry users = registered("users");
        Path spoolFile = users.getSpool().getFile();
        engine.onRecord(users, MAPPER.readTree("{\"id\":1}"));
        engine.onRecord(users, MAPPER.readTree("{\"id\":2}"));

        assertTrue(engine.finish(List.of(users)));

        assertEquals(List.of("{\"id\":1}", "{\"id\":2}"), warehouse.loads.get(0).lines());
        assertEquals(2, users.getAcceptedRows());
        assertFalse(Files.exists(spoolFile));
    }

    @Test
    @DisplayName("Should truncate for FULL_TABLE replication")
    void testFullTable() throws Exception {
        properties.setReplicationMethod("full_table");
        TableEntry users = registered("users");

        engine.finish(List.of(users));

        assertTrue(warehouse.loads.get(0).truncate());
    }

    @Test
    @DisplayName("Should truncate only forced full tables")
    void testForcedFullTable() throws Exception {
        properties.setForcedFulltables(List.of("orders"));
        TableEntry users = registered("users");
        TableEntry orders = registered("orders");

        engine.finish(List.of(users, orders));

        assertFalse(warehouse.loads.get(0).truncate());
        assertTrue(warehouse.loads.get(1).truncate());
    }

    @Test
    @DisplayName("Should abort the remaining loads on the first failed job")
    void testLoadFailure() throws Exception {
        warehouse.nextLoadErrors = List.of(RowError.jobLevel("invalid", "schema mismatch"));
        TableEntry users = registered("users");
        TableEntry orders = registered("orders");

        LoadFailureException ex = assertThrows(LoadFailureException.class, () -> engine.finish(List.of(users, orders)));

        assertEquals("users", ex.getTableName());
        assertEquals(1, ex.getErrors().size());
        assertEquals(List.of("load:users"), warehouse.calls);
        users.close();
        orders.close();
    }
}
