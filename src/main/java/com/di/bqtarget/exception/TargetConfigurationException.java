package com.di.bqtarget.exception;

/**
 * Configuration is missing a required key or could not be read.
 */
public class TargetConfigurationException extends TargetException {

    public TargetConfigurationException(String message) {
        super(message);
    }

    public TargetConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
