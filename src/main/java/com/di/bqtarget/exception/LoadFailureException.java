package com.di.bqtarget.exception;

import com.di.bqtarget.warehouse.RowError;
import lombok.Getter;

import java.util.List;

/**
 * A bulk load of a spooled table failed.
 */
@Getter
public class LoadFailureException extends TargetException {

    private final String tableName;
    private final List<RowError> errors;

    public LoadFailureException(String tableName, List<RowError> errors) {
        super(String.format("Failed to load table %s from file:%n%s", tableName, RowError.describe(errors)));
        this.tableName = tableName;
        this.errors = List.copyOf(errors);
    }

    public LoadFailureException(String tableName, Throwable cause) {
        super("Failed to load table " + tableName + " from file: " + cause.getMessage(), cause);
        this.tableName = tableName;
        this.errors = List.of();
    }
}
