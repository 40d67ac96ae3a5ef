package com.di.bqtarget.schema;

/**
 * A primitive type, optionally refined by a {@code format} hint ({@code date-time}, {@code float}, ...).
 */
public record LiteralType(LiteralKind kind, String format) implements TypeNode {

    @Override
    public boolean isNullLiteral() {
        return kind == LiteralKind.NULL;
    }
}
