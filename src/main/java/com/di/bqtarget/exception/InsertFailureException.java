package com.di.bqtarget.exception;

import com.di.bqtarget.warehouse.RowError;
import lombok.Getter;

import java.util.List;

/**
 * A streaming insert was rejected by the warehouse.
 */
@Getter
public class InsertFailureException extends TargetException {

    private final String tableName;
    private final List<RowError> errors;

    public InsertFailureException(String tableName, List<RowError> errors) {
        super(String.format("Failed to insert rows for %s:%n%s", tableName, RowError.describe(errors)));
        this.tableName = tableName;
        this.errors = List.copyOf(errors);
    }

    public InsertFailureException(String tableName, Throwable cause) {
        super("Failed to insert rows for " + tableName + ": " + cause.getMessage(), cause);
        this.tableName = tableName;
        this.errors = List.of();
    }
}
