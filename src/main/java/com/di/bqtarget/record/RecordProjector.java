package com.di.bqtarget.record;

import com.di.bqtarget.exception.UnknownTypeException;
import com.di.bqtarget.schema.ArrayType;
import com.di.bqtarget.schema.LiteralType;
import com.di.bqtarget.schema.ObjectType;
import com.di.bqtarget.schema.TypeNode;
import com.di.bqtarget.schema.UnionType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Conforms a record to its declared schema: object keys that the schema does not declare are
 * dropped, at every depth. Literal values pass through untouched (validation happens before).
 *
 * <p>Unions follow the same first-non-null rule as {@link com.di.bqtarget.schema.SchemaTranslator},
 * so the projected shape always matches the translated columns.
 */
public final class RecordProjector {

    private RecordProjector() {}

    public static JsonNode project(TypeNode schema, JsonNode value) {
        if (isAbsent(value)) {
            return value;
        }

        if (schema instanceof UnionType union) {
            return project(union.resolve(), value);
        }
        if (schema instanceof LiteralType literal) {
            if (literal.isNullLiteral()) {
                throw new UnknownTypeException("type null is unknown for value " + value);
            }
            return value;
        }
        if (schema instanceof ObjectType object) {
            return projectObject(object, value);
        }
        if (schema instanceof ArrayType array) {
            return projectArray(array, value);
        }
        throw new UnknownTypeException("type of schema node " + schema + " is unknown");
    }

    private static JsonNode projectObject(ObjectType object, JsonNode value) {
        if (!value.isObject()) {
            return value;
        }
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, TypeNode> property : object.properties().entrySet()) {
            String key = property.getKey();
            if (value.has(key)) {
                out.set(key, project(property.getValue(), value.get(key)));
            }
        }
        return out;
    }

    private static JsonNode projectArray(ArrayType array, JsonNode value) {
        TypeNode items = array.items().resolve();
        if (!(items instanceof ObjectType) || !value.isArray()) {
            return value;
        }
        ArrayNode out = JsonNodeFactory.instance.arrayNode(value.size());
        for (JsonNode element : value) {
            out.add(project(items, element));
        }
        return out;
    }

    private static boolean isAbsent(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return true;
        }
        if (value.isContainerNode()) {
            return value.isEmpty();
        }
        return value.isTextual() && value.asText().isEmpty();
    }
}
