package com.di.bqtarget.schema;

/**
 * An {@code array} node with a single item type.
 */
public record ArrayType(TypeNode items) implements TypeNode {
}
