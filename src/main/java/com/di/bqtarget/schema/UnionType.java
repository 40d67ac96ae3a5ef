package com.di.bqtarget.schema;

import com.di.bqtarget.exception.UnknownTypeException;

import java.util.List;

/**
 * An {@code anyOf} node.
 *
 * <p>Only the first non-null alternative is ever used for storage. Further non-null
 * alternatives are discarded, so polymorphic fields keep only their first shape.
 */
public record UnionType(List<TypeNode> alternatives) implements TypeNode {

    public UnionType {
        alternatives = List.copyOf(alternatives);
    }

    @Override
    public TypeNode resolve() {
        for (TypeNode alternative : alternatives) {
            if (!alternative.isNullLiteral()) {
                return alternative.resolve();
            }
        }
        throw new UnknownTypeException("anyOf has no non-null alternative: " + alternatives);
    }
}
