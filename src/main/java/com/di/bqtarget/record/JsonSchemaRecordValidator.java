package com.di.bqtarget.record;

import com.di.bqtarget.exception.RecordValidationException;
import com.di.bqtarget.ingest.TableEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates records with the networknt JSON Schema validator (draft 4, the dialect Singer taps emit).
 * Compiled schemas are cached per table and recompiled when the table's schema is replaced.
 *
 * <p>{@code format} is an annotation only: it is removed from the compiled copy of the schema, so
 * a {@code date-time} string without a zone still passes. Types and structure are enforced.
 */
@Slf4j
public class JsonSchemaRecordValidator implements RecordValidator {

    /** Keywords whose value is a subschema or an array of subschemas. */
    private static final List<String> SUBSCHEMA_KEYWORDS =
            List.of("items", "additionalItems", "additionalProperties", "not", "anyOf", "allOf", "oneOf");

    /** Keywords whose value maps names to subschemas. */
    private static final List<String> SUBSCHEMA_MAPS =
            List.of("properties", "patternProperties", "definitions", "dependencies");

    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V4);

    private final Map<String, Compiled> compiled = new HashMap<>();

    @Override
    public void validate(TableEntry entry, JsonNode record) {
        JsonSchema schema = schemaFor(entry);
        Set<ValidationMessage> messages = schema.validate(record);
        if (!messages.isEmpty()) {
            List<String> violations = messages.stream().map(ValidationMessage::getMessage).sorted().toList();
            log.error("[RECORD] validation failed for {}: {}", entry.getTableName(), violations);
            throw new RecordValidationException(entry.getTableName(), violations);
        }
    }

    private JsonSchema schemaFor(TableEntry entry) {
        Compiled cached = compiled.get(entry.getTableName());
        if (cached == null || cached.source() != entry.getRawSchema()) {
            log.debug("[RECORD] compiling validation schema for {}", entry.getTableName());
            cached = new Compiled(entry.getRawSchema(), factory.getSchema(withoutFormats(entry.getRawSchema())));
            compiled.put(entry.getTableName(), cached);
        }
        return cached.schema();
    }

    static JsonNode withoutFormats(JsonNode schema) {
        if (schema == null || !schema.isContainerNode()) {
            return schema;
        }
        JsonNode copy = schema.deepCopy();
        dropFormats(copy);
        return copy;
    }

    private static void dropFormats(JsonNode node) {
        if (node == null) {
            return;
        }
        if (node.isArray()) {
            node.forEach(JsonSchemaRecordValidator::dropFormats);
            return;
        }
        if (!node.isObject()) {
            return;
        }
        ObjectNode schema = (ObjectNode) node;
        if (schema.path("format").isTextual()) {
            schema.remove("format");
        }
        for (String keyword : SUBSCHEMA_KEYWORDS) {
            dropFormats(schema.get(keyword));
        }
        for (String keyword : SUBSCHEMA_MAPS) {
            JsonNode named = schema.get(keyword);
            if (named != null && named.isObject()) {
                named.forEach(JsonSchemaRecordValidator::dropFormats);
            }
        }
    }

    private record Compiled(JsonNode source, JsonSchema schema) {}
}
