package com.di.bqtarget.schema;

/**
 * One node of a parsed stream schema. Implementations form a closed recursive variant:
 * {@link LiteralType}, {@link UnionType}, {@link ObjectType}, {@link ArrayType} and
 * {@link UntypedNode}.
 */
public interface TypeNode {

    /**
     * The node that decides the storage kind. Unions resolve to their first non-null
     * alternative; every other node resolves to itself.
     */
    default TypeNode resolve() {
        return this;
    }

    default boolean isNullLiteral() {
        return false;
    }
}
