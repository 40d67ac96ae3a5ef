package com.di.bqtarget.ingest;

import com.di.bqtarget.schema.ColumnDefinition;
import com.di.bqtarget.schema.SchemaTranslator;
import com.di.bqtarget.schema.TypeNode;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Everything the target tracks for one destination table during a run: the latest schema, its
 * key properties, and the engine-specific handles (spool for batch loads, counters and the
 * recreated flag for streaming inserts).
 */
@Getter
public class TableEntry implements AutoCloseable {

    private final String streamName;
    private final String tableName;

    private JsonNode rawSchema;
    private TypeNode schema;
    private List<String> keyProperties;

    @Setter
    private RecordSpool spool;

    /** Set once the streaming engine has dropped and recreated the table in this run. */
    @Setter
    private boolean recreated;

    private long acceptedRows;
    private long errorRows;

    public TableEntry(String streamName, String tableName, JsonNode rawSchema, TypeNode schema, List<String> keyProperties) {
        this.streamName = streamName;
        this.tableName = tableName;
        replaceSchema(rawSchema, schema, keyProperties);
    }

    /** Replaces (does not merge) the schema and key properties. */
    public void replaceSchema(JsonNode rawSchema, TypeNode schema, List<String> keyProperties) {
        this.rawSchema = rawSchema;
        this.schema = schema;
        this.keyProperties = keyProperties == null ? List.of() : List.copyOf(keyProperties);
    }

    public List<ColumnDefinition> columns() {
        return SchemaTranslator.buildSchema(schema, keyProperties);
    }

    public void recordAccepted(long rows) {
        acceptedRows += rows;
    }

    public void recordErrors(long rows) {
        errorRows += rows;
    }

    @Override
    public void close() {
        if (spool != null) {
            spool.close();
        }
    }
}
