package com.di.bqtarget.message;

/**
 * Accepted for compatibility with taps that emit it; the target ignores it.
 */
public record ActivateVersionMessage(String stream, long version) implements SingerMessage {

    @Override
    public MessageType type() {
        return MessageType.ACTIVATE_VERSION;
    }
}
