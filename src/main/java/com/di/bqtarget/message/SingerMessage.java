package com.di.bqtarget.message;

/**
 * A decoded input line.
 */
public interface SingerMessage {

    MessageType type();
}
