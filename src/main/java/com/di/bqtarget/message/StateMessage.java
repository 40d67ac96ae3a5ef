package com.di.bqtarget.message;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Checkpoint. The value is opaque to the target and is echoed back verbatim.
 */
public record StateMessage(JsonNode value) implements SingerMessage {

    @Override
    public MessageType type() {
        return MessageType.STATE;
    }
}
