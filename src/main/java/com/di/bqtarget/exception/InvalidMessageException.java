package com.di.bqtarget.exception;

/**
 * A line decoded as JSON but is not a recognised Singer message, or lacks a field its kind requires.
 */
public class InvalidMessageException extends TargetException {

    public InvalidMessageException(String message) {
        super(message);
    }
}
