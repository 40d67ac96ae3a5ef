package com.di.bqtarget.message;

import java.util.Locale;

/**
 * Singer message kinds understood by the target.
 */
public enum MessageType {
    SCHEMA,
    RECORD,
    STATE,
    ACTIVATE_VERSION;

    /** @return the kind for a {@code type} discriminator, or {@code null} when unknown */
    public static MessageType fromWire(String type) {
        if (type == null) return null;
        try {
            return valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
