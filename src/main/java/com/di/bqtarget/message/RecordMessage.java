package com.di.bqtarget.message;

import com.fasterxml.jackson.databind.JsonNode;

public record RecordMessage(String stream, JsonNode record) implements SingerMessage {

    @Override
    public MessageType type() {
        return MessageType.RECORD;
    }
}
