package com.di.bqtarget.exception;

import lombok.Getter;

import java.util.List;

/**
 * A record does not satisfy the JSON schema declared for its stream.
 */
@Getter
public class RecordValidationException extends TargetException {

    private final String tableName;
    private final List<String> violations;

    public RecordValidationException(String tableName, List<String> violations) {
        super(String.format("Record for %s does not match its schema: %s", tableName, String.join("; ", violations)));
        this.tableName = tableName;
        this.violations = List.copyOf(violations);
    }
}
