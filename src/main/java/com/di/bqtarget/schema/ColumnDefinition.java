package com.di.bqtarget.schema;

import java.util.List;

/**
 * A translated warehouse column. {@code fields} is non-empty only for {@link StorageKind#RECORD}.
 */
public record ColumnDefinition(String name, StorageKind kind, ColumnMode mode, List<ColumnDefinition> fields) {

    public ColumnDefinition {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static ColumnDefinition scalar(String name, StorageKind kind, ColumnMode mode) {
        return new ColumnDefinition(name, kind, mode, List.of());
    }

    public boolean isRecord() {
        return kind == StorageKind.RECORD;
    }
}
