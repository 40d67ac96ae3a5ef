package com.di.bqtarget.message;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record SchemaMessage(String stream, JsonNode schema, List<String> keyProperties) implements SingerMessage {

    public SchemaMessage {
        keyProperties = keyProperties == null ? List.of() : List.copyOf(keyProperties);
    }

    @Override
    public MessageType type() {
        return MessageType.SCHEMA;
    }
}
