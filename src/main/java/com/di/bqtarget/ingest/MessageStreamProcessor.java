package com.di.bqtarget.ingest;

import com.di.bqtarget.checkpoint.CheckpointSink;
import com.di.bqtarget.exception.InvalidMessageException;
import com.di.bqtarget.exception.SchemaNotFoundException;
import com.di.bqtarget.message.MessageParser;
import com.di.bqtarget.message.RecordMessage;
import com.di.bqtarget.message.SchemaMessage;
import com.di.bqtarget.message.SingerMessage;
import com.di.bqtarget.message.StateMessage;
import com.di.bqtarget.record.RecordProjector;
import com.di.bqtarget.record.RecordValidator;
import com.di.bqtarget.schema.SchemaParser;
import com.di.bqtarget.schema.TypeNode;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Reads Singer messages line by line and drives one {@link IngestionEngine}.
 *
 * <ul>
 *   <li>SCHEMA registers (or replaces) the table entry and hands it to the engine.</li>
 *   <li>RECORD is validated, projected onto the schema, handed to the engine, and makes the
 *       pending checkpoint stale.</li>
 *   <li>STATE overwrites the pending checkpoint.</li>
 * </ul>
 *
 * <p>When the input ends the engine finishes every table in registration order; only then is
 * the pending checkpoint emitted. Single-threaded; one instance per run.
 */
@Slf4j
public class MessageStreamProcessor {

    private final MessageParser parser;
    private final IngestionEngine engine;
    private final RecordValidator validator;
    private final CheckpointSink checkpointSink;
    private final UnaryOperator<String> tableNaming;

    private final Map<String, TableEntry> tables = new LinkedHashMap<>();
    private final CheckpointHolder checkpoint = new CheckpointHolder();

    private long lineNumber;
    private long records;

    public MessageStreamProcessor(MessageParser parser,
                                  IngestionEngine engine,
                                  RecordValidator validator,
                                  CheckpointSink checkpointSink,
                                  UnaryOperator<String> tableNaming) {
        this.parser = parser;
        this.engine = engine;
        this.validator = validator;
        this.checkpointSink = checkpointSink;
        this.tableNaming = tableNaming;
    }

    public ProcessingSummary process(BufferedReader input) throws IOException {
        try {
            String line;
            while ((line = input.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                dispatch(parser.parse(line, lineNumber));
            }

            log.info("[TARGET] input exhausted after {} line(s), {} record(s), {} table(s)",
                    lineNumber, records, tables.size());

            boolean emitted = false;
            if (engine.finish(tables.values())) {
                JsonNode state = checkpoint.current().orElse(null);
                if (state != null) {
                    checkpointSink.emit(state);
                    emitted = true;
                }
            }
            return new ProcessingSummary(lineNumber, records, new ArrayList<>(tables.keySet()), emitted);
        } finally {
            tables.values().forEach(TableEntry::close);
        }
    }

    private void dispatch(SingerMessage message) {
        switch (message.type()) {
            case SCHEMA -> onSchema((SchemaMessage) message);
            case RECORD -> onRecord((RecordMessage) message);
            case STATE -> onState((StateMessage) message);
            case ACTIVATE_VERSION -> log.debug("[TARGET] ignoring ACTIVATE_VERSION on line {}", lineNumber);
            default -> throw new InvalidMessageException("Unrecognized Singer Message on line " + lineNumber);
        }
    }

    private void onSchema(SchemaMessage message) {
        String table = tableNaming.apply(message.stream());
        TableEntry entry = tables.get(table);

        if (entry != null && engine.keepsFirstSchema()) {
            log.debug("[SCHEMA] {} already registered, keeping its first schema", table);
            return;
        }

        TypeNode schema = SchemaParser.parse(message.schema());
        if (entry == null) {
            entry = new TableEntry(message.stream(), table, message.schema(), schema, message.keyProperties());
            tables.put(table, entry);
            log.info("[SCHEMA] registered stream {} as table {} (key properties {})",
                    message.stream(), table, message.keyProperties());
        } else {
            entry.replaceSchema(message.schema(), schema, message.keyProperties());
            log.info("[SCHEMA] replaced schema of table {}", table);
        }
        engine.onSchema(entry);
    }

    private void onRecord(RecordMessage message) {
        String table = tableNaming.apply(message.stream());
        TableEntry entry = tables.get(table);
        if (entry == null) {
            throw new SchemaNotFoundException(table);
        }

        validator.validate(entry, message.record());
        JsonNode projected = RecordProjector.project(entry.getSchema(), message.record());
        engine.onRecord(entry, projected);

        records++;
        checkpoint.clear();
    }

    private void onState(StateMessage message) {
        log.debug("[STATE] Setting state to {}", message.value());
        checkpoint.set(message.value());
    }
}
