package com.di.bqtarget.record;

import com.di.bqtarget.schema.FieldNameSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Serializes projected records for the warehouse.
 *
 * <p>Decimals are written as their exact plain text inside a JSON string, never as a binary
 * double. Object keys get the same sanitization as column names so rows line up with the
 * translated schema.
 */
@Component
public class RecordEncoder {

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper();

    /** One newline-delimited JSON line, without the trailing newline. */
    public String encodeLine(JsonNode record) {
        try {
            return objectMapper.writeValueAsString(normalize(record));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize record: " + e.getOriginalMessage(), e);
        }
    }

    /** Row content for a streaming insert. */
    public Map<String, Object> toRowContent(JsonNode record) {
        JsonNode normalized = normalize(record);
        if (!normalized.isObject()) {
            throw new IllegalArgumentException("A row must be a JSON object, got " + normalized.getNodeType());
        }
        return objectMapper.convertValue(normalized, ROW_TYPE);
    }

    JsonNode normalize(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isBigDecimal()) {
            return TextNode.valueOf(node.decimalValue().toPlainString());
        }
        if (node.isObject()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                out.set(FieldNameSanitizer.sanitize(e.getKey()), normalize(e.getValue()));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode(node.size());
            node.forEach(element -> out.add(normalize(element)));
            return out;
        }
        return node;
    }
}
