package com.di.bqtarget.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A node with neither a recognised {@code type} nor {@code anyOf}. Kept so the error can show the
 * offending node, and so empty property schemas ({@code {}}) can be skipped.
 */
public record UntypedNode(JsonNode raw) implements TypeNode {

    public boolean isEmpty() {
        return raw == null || raw.isNull() || (raw.isObject() && raw.isEmpty());
    }
}
