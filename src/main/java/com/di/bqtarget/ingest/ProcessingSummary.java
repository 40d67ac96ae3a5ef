package com.di.bqtarget.ingest;

import java.util.List;

/**
 * What one run did, for the final log line and for tests.
 */
public record ProcessingSummary(long lines, long records, List<String> tables, boolean checkpointEmitted) {

    public ProcessingSummary {
        tables = List.copyOf(tables);
    }
}
