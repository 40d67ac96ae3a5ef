package com.di.bqtarget.schema;

import java.util.Locale;

/**
 * JSON Schema primitive type names, plus the {@code null} marker used in type lists and unions.
 */
public enum LiteralKind {
    BOOLEAN,
    NUMBER,
    INTEGER,
    STRING,
    NULL;

    /** @return the kind for a JSON Schema type name, or {@code null} when it is not a literal */
    public static LiteralKind fromTypeName(String typeName) {
        if (typeName == null) return null;
        return switch (typeName.trim().toLowerCase(Locale.ROOT)) {
            case "boolean" -> BOOLEAN;
            case "number" -> NUMBER;
            case "integer" -> INTEGER;
            case "string" -> STRING;
            case "null" -> NULL;
            default -> null;
        };
    }
}
