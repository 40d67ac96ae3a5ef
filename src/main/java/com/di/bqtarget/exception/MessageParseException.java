package com.di.bqtarget.exception;

import lombok.Getter;

/**
 * An input line could not be decoded as JSON.
 */
@Getter
public class MessageParseException extends TargetException {

    private static final int MAX_LINE_IN_MESSAGE = 500;

    private final long lineNumber;

    public MessageParseException(long lineNumber, String line, Throwable cause) {
        super(String.format("Unable to parse Singer message on line %d: %s", lineNumber, abbreviate(line)), cause);
        this.lineNumber = lineNumber;
    }

    private static String abbreviate(String line) {
        if (line == null) return "<null>";
        return line.length() <= MAX_LINE_IN_MESSAGE ? line : line.substring(0, MAX_LINE_IN_MESSAGE) + "...";
    }
}
