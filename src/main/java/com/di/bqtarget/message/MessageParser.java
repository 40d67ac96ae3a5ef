package com.di.bqtarget.message;

import com.di.bqtarget.exception.InvalidMessageException;
import com.di.bqtarget.exception.MessageParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes one input line into a {@link SingerMessage}.
 *
 * <p>Fractional numbers are read as {@link java.math.BigDecimal} so record values keep their
 * exact precision all the way to the warehouse.
 */
@Slf4j
@Component
public class MessageParser {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    /**
     * @param line       raw line, without the line terminator
     * @param lineNumber 1-based position in the input, for error messages
     * @throws MessageParseException   when the line is not JSON
     * @throws InvalidMessageException when the JSON is not a Singer message
     */
    public SingerMessage parse(String line, long lineNumber) {
        JsonNode node;
        try {
            node = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            log.error("Unable to parse Singer Message on line {}:\n{}", lineNumber, line);
            throw new MessageParseException(lineNumber, line, e);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidMessageException("Line " + lineNumber + " is not a JSON object: " + line);
        }

        String typeName = node.path("type").asText(null);
        MessageType type = MessageType.fromWire(typeName);
        if (type == null) {
            throw new InvalidMessageException("Unrecognized Singer Message on line " + lineNumber + ":\n " + line);
        }

        return switch (type) {
            case SCHEMA -> new SchemaMessage(
                    requireText(node, "stream", lineNumber),
                    requireObject(node, "schema", lineNumber),
                    keyProperties(node, lineNumber));
            case RECORD -> new RecordMessage(
                    requireText(node, "stream", lineNumber),
                    require(node, "record", lineNumber));
            case STATE -> new StateMessage(node.has("value") ? node.get("value") : NullNode.getInstance());
            case ACTIVATE_VERSION -> new ActivateVersionMessage(
                    requireText(node, "stream", lineNumber),
                    node.path("version").asLong());
        };
    }

    private static JsonNode require(JsonNode node, String field, long lineNumber) {
        JsonNode value = node.get(field);
        if (value == null) {
            throw new InvalidMessageException(String.format(
                    "%s message on line %d is missing '%s'", node.path("type").asText(), lineNumber, field));
        }
        return value;
    }

    private static String requireText(JsonNode node, String field, long lineNumber) {
        JsonNode value = require(node, field, lineNumber);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new InvalidMessageException(String.format(
                    "%s message on line %d has an invalid '%s': %s", node.path("type").asText(), lineNumber, field, value));
        }
        return value.asText();
    }

    private static JsonNode requireObject(JsonNode node, String field, long lineNumber) {
        JsonNode value = require(node, field, lineNumber);
        if (!value.isObject()) {
            throw new InvalidMessageException(String.format(
                    "%s message on line %d has a non-object '%s'", node.path("type").asText(), lineNumber, field));
        }
        return value;
    }

    private static List<String> keyProperties(JsonNode node, long lineNumber) {
        JsonNode keys = node.get("key_properties");
        List<String> out = new ArrayList<>();
        if (keys == null || keys.isNull()) {
            return out;
        }
        if (keys.isTextual()) {
            out.add(keys.asText());
            return out;
        }
        if (!keys.isArray()) {
            throw new InvalidMessageException("SCHEMA message on line " + lineNumber + " has invalid 'key_properties': " + keys);
        }
        keys.forEach(k -> out.add(k.asText()));
        return out;
    }
}
