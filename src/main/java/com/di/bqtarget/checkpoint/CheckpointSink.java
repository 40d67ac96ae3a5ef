package com.di.bqtarget.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives the latest safe checkpoint for the orchestrating caller.
 */
public interface CheckpointSink {

    void emit(JsonNode state);
}
