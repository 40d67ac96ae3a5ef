package com.di.bqtarget.exception;

/**
 * Base type for every fatal failure raised while ingesting a message stream.
 *
 * <p>None of these are retried inside the process. The orchestrating caller re-runs the
 * whole target; that is safe because a checkpoint is only emitted after the records
 * preceding it are durably stored.
 */
public class TargetException extends RuntimeException {

    public TargetException(String message) {
        super(message);
    }

    public TargetException(String message, Throwable cause) {
        super(message, cause);
    }
}
