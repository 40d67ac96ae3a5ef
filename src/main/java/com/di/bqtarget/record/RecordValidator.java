package com.di.bqtarget.record;

import com.di.bqtarget.ingest.TableEntry;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Checks a raw record against the JSON schema registered for its table.
 */
public interface RecordValidator {

    /** @throws com.di.bqtarget.exception.RecordValidationException when the record does not conform */
    void validate(TableEntry entry, JsonNode record);

    static RecordValidator disabled() {
        return (entry, record) -> { };
    }
}
