package com.di.bqtarget.ingest;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;

/**
 * Strategy that moves projected records into the warehouse.
 */
public interface IngestionEngine {

    /** The strategy key, e.g. "batch" or "streaming". */
    String type();

    /**
     * When {@code true}, a repeated SCHEMA for an already registered table is ignored and the
     * first schema of the run is kept.
     */
    default boolean keepsFirstSchema() {
        return false;
    }

    /** Called for a newly registered table and, unless {@link #keepsFirstSchema()}, for every schema replacement. */
    void onSchema(TableEntry entry);

    void onRecord(TableEntry entry, JsonNode projectedRecord);

    /**
     * Completes every table after the input is exhausted, in registration order.
     *
     * @return {@code true} when every table finished cleanly and the pending checkpoint may be emitted
     */
    boolean finish(Collection<TableEntry> entries);
}
