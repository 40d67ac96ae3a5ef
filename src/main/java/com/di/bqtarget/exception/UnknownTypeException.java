package com.di.bqtarget.exception;

/**
 * A schema node has no type the target knows how to map, or uses a shape the warehouse cannot hold.
 */
public class UnknownTypeException extends TargetException {

    public UnknownTypeException(String message) {
        super(message);
    }
}
