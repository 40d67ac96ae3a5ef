package com.di.bqtarget.schema;

public enum ColumnMode {
    REQUIRED,
    NULLABLE,
    REPEATED
}
