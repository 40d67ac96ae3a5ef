package com.di.bqtarget.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Writes each checkpoint as one JSON line to standard output and flushes immediately.
 * Standard output carries nothing else; logs go to standard error.
 */
@Slf4j
@Component
public class StdoutCheckpointSink implements CheckpointSink {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PrintStream out;

    public StdoutCheckpointSink() {
        this(System.out);
    }

    public StdoutCheckpointSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void emit(JsonNode state) {
        if (state == null || state.isNull()) {
            return;
        }
        String line;
        try {
            line = objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize state " + state, e);
        }
        log.debug("[STATE] Emitting state {}", line);
        out.print(line);
        out.print('\n');
        out.flush();
    }
}
