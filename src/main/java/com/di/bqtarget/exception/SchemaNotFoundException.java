package com.di.bqtarget.exception;

import lombok.Getter;

/**
 * A RECORD arrived for a table that has not been declared by a SCHEMA message yet.
 */
@Getter
public class SchemaNotFoundException extends TargetException {

    private final String tableName;

    public SchemaNotFoundException(String tableName) {
        super("A record for stream " + tableName + " was encountered before a corresponding schema");
        this.tableName = tableName;
    }
}
