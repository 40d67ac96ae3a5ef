package com.di.bqtarget.ingest;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Single slot for the latest checkpoint. A new STATE overwrites it; any RECORD clears it, since
 * a checkpoint is only safe to emit when nothing was appended after it.
 */
public class CheckpointHolder {

    private JsonNode pending;

    public void set(JsonNode value) {
        pending = value;
    }

    public void clear() {
        pending = null;
    }

    /** The pending checkpoint, empty when none is safe to emit. A JSON {@code null} value counts as none. */
    public Optional<JsonNode> current() {
        if (pending == null || pending.isNull() || pending.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(pending);
    }
}
