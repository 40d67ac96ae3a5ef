package com.di.bqtarget.schema;

/**
 * Column types of the target warehouse.
 */
public enum StorageKind {
    BOOLEAN,
    INT64,
    FLOAT64,
    NUMERIC,
    BIGNUMERIC,
    STRING,
    DATE,
    TIME,
    TIMESTAMP,
    RECORD
}
