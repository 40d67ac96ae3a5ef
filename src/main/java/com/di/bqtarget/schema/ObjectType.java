package com.di.bqtarget.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * An {@code object} node. Property order is the declaration order of the schema.
 */
public record ObjectType(Map<String, TypeNode> properties, Set<String> required) implements TypeNode {

    public ObjectType {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = Collections.unmodifiableSet(new LinkedHashSet<>(required));
    }
}
