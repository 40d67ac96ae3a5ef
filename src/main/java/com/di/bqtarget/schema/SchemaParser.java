package com.di.bqtarget.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a Singer (JSON Schema) document into the {@link TypeNode} tree.
 *
 * <p>Rules:
 * <ul>
 *   <li>{@code anyOf} wins over {@code type} when both are present.</li>
 *   <li>{@code type} may be a name or a list of names; {@code "null"} in a list is ignored
 *       and the first non-null name is the node's kind. Column modes come from required sets,
 *       never from nullability.</li>
 *   <li>Nodes without a usable type become {@link UntypedNode}; the translator and projector
 *       decide whether that is fatal.</li>
 * </ul>
 */
public final class SchemaParser {

    private SchemaParser() {}

    public static TypeNode parse(JsonNode schema) {
        if (schema == null || !schema.isObject()) {
            return new UntypedNode(schema);
        }

        JsonNode anyOf = schema.get("anyOf");
        if (anyOf != null && anyOf.isArray()) {
            List<TypeNode> alternatives = new ArrayList<>(anyOf.size());
            anyOf.forEach(alt -> alternatives.add(parse(alt)));
            return new UnionType(alternatives);
        }

        JsonNode type = schema.get("type");
        if (type == null || type.isNull()) {
            return new UntypedNode(schema);
        }

        String typeName = null;
        if (type.isTextual()) {
            typeName = type.asText();
        } else if (type.isArray()) {
            boolean onlyNull = false;
            for (JsonNode t : type) {
                String name = t.asText();
                if ("null".equalsIgnoreCase(name)) {
                    onlyNull = true;
                } else if (typeName == null) {
                    typeName = name;
                }
            }
            if (typeName == null && onlyNull) {
                typeName = "null";
            }
        }
        if (typeName == null) {
            return new UntypedNode(schema);
        }

        switch (typeName.toLowerCase()) {
            case "object":
                return parseObject(schema);
            case "array":
                JsonNode items = schema.get("items");
                return new ArrayType(parse(items == null ? JsonNodeFactory.instance.objectNode() : items));
            default:
                LiteralKind kind = LiteralKind.fromTypeName(typeName);
                if (kind == null) {
                    return new UntypedNode(schema);
                }
                JsonNode format = schema.get("format");
                return new LiteralType(kind, format != null && format.isTextual() ? format.asText() : null);
        }
    }

    private static ObjectType parseObject(JsonNode schema) {
        Map<String, TypeNode> properties = new LinkedHashMap<>();
        JsonNode props = schema.get("properties");
        if (props != null && props.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = props.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                properties.put(e.getKey(), parse(e.getValue()));
            }
        }
        Set<String> required = new LinkedHashSet<>();
        JsonNode req = schema.get("required");
        if (req != null && req.isArray()) {
            req.forEach(r -> required.add(r.asText()));
        }
        return new ObjectType(properties, required);
    }
}
