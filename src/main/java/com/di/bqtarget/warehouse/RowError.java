package com.di.bqtarget.warehouse;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One structured error reported by the warehouse for a load job or an inserted row.
 *
 * @param rowIndex index of the offending row within the request, or -1 when the error is job-level
 */
public record RowError(long rowIndex, String reason, String message) {

    public static RowError jobLevel(String reason, String message) {
        return new RowError(-1, reason, message);
    }

    /** One {@code reason: ..., message: ...} line per error, in the order reported. */
    public static String describe(List<RowError> errors) {
        if (errors == null || errors.isEmpty()) return "<no details>";
        return errors.stream()
                .map(e -> (e.rowIndex() >= 0 ? "row " + e.rowIndex() + ", " : "")
                        + "reason: " + e.reason() + ", message: " + e.message())
                .collect(Collectors.joining("\n"));
    }
}
