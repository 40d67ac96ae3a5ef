package com.di.bqtarget.warehouse;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one bulk load job.
 */
@Value
@Builder
public class LoadOutcome {

    String jobId;

    /** Rows the warehouse reports as written; 0 when unknown. */
    long outputRows;

    /** Structured reasons when the job failed; empty on success. */
    @Builder.Default
    List<RowError> errors = List.of();

    public boolean isSuccessful() {
        return errors == null || errors.isEmpty();
    }
}
