package com.di.bqtarget.exception;

/**
 * The requested combination of options cannot be honoured, e.g. streaming inserts with FULL_TABLE replication.
 */
public class UnsupportedConfigurationException extends TargetException {

    public UnsupportedConfigurationException(String message) {
        super(message);
    }
}
