package com.di.bqtarget.schema;

import com.di.bqtarget.exception.UnknownTypeException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Translates a stream schema into BigQuery column definitions.
 *
 * <p>Mapping of literal kinds:
 * <ul>
 *   <li>{@code boolean} → BOOLEAN, {@code integer} → INT64</li>
 *   <li>{@code number} → NUMERIC, or FLOAT64 / NUMERIC / BIGNUMERIC for format
 *       {@code float} / {@code numeric} / {@code bignumeric}</li>
 *   <li>{@code string} → STRING, or TIMESTAMP / DATE / TIME for format
 *       {@code date-time} / {@code date} / {@code time}</li>
 * </ul>
 *
 * <p>Objects become RECORD columns with their properties as children, arrays become REPEATED
 * columns of their item kind. A column is REQUIRED only when its name is in the required set
 * handed in by the caller; arrays are REPEATED regardless.
 */
@Slf4j
public final class SchemaTranslator {

    private SchemaTranslator() {}

    /**
     * Builds the table schema of a stream.
     *
     * @param schema        parsed stream schema, must resolve to an object
     * @param keyProperties the stream's key properties; they are REQUIRED in addition to the
     *                      schema's own {@code required} list
     */
    public static List<ColumnDefinition> buildSchema(TypeNode schema, Collection<String> keyProperties) {
        TypeNode resolved = schema.resolve();
        if (!(resolved instanceof ObjectType root)) {
            throw new UnknownTypeException("Stream schema must be an object, got: " + describe(schema));
        }
        Set<String> required = new LinkedHashSet<>();
        if (keyProperties != null) {
            required.addAll(keyProperties);
        }
        required.addAll(root.required());
        return buildColumns(root, required);
    }

    /**
     * Translates one field.
     *
     * @param node              the field's type node
     * @param fieldName         legal column name (already sanitized)
     * @param requiredFieldNames names, in the same sanitized form, that must be REQUIRED
     */
    public static ColumnDefinition translate(TypeNode node, String fieldName, Set<String> requiredFieldNames) {
        ColumnMode mode = requiredFieldNames != null && requiredFieldNames.contains(fieldName)
                ? ColumnMode.REQUIRED
                : ColumnMode.NULLABLE;

        TypeNode resolved = node.resolve();

        if (resolved instanceof ObjectType object) {
            return new ColumnDefinition(fieldName, StorageKind.RECORD, mode, buildColumns(object, object.required()));
        }
        if (resolved instanceof ArrayType array) {
            return translateArray(array, fieldName);
        }
        if (resolved instanceof LiteralType literal) {
            return ColumnDefinition.scalar(fieldName, literalKind(literal, fieldName), mode);
        }
        throw new UnknownTypeException("unknown type for field '" + fieldName + "': " + describe(node));
    }

    private static ColumnDefinition translateArray(ArrayType array, String fieldName) {
        TypeNode items = array.items().resolve();
        if (items instanceof ObjectType object) {
            return new ColumnDefinition(fieldName, StorageKind.RECORD, ColumnMode.REPEATED,
                    buildColumns(object, object.required()));
        }
        if (items instanceof LiteralType literal) {
            return ColumnDefinition.scalar(fieldName, literalKind(literal, fieldName), ColumnMode.REPEATED);
        }
        if (items instanceof ArrayType) {
            throw new UnknownTypeException("Nested arrays are not supported for field '" + fieldName + "'");
        }
        throw new UnknownTypeException("unknown array item type for field '" + fieldName + "': " + describe(array.items()));
    }

    private static List<ColumnDefinition> buildColumns(ObjectType object, Set<String> required) {
        Set<String> sanitizedRequired = FieldNameSanitizer.sanitizeAll(required);
        List<ColumnDefinition> columns = new ArrayList<>(object.properties().size());
        for (Map.Entry<String, TypeNode> property : object.properties().entrySet()) {
            TypeNode child = property.getValue();
            if (child instanceof UntypedNode untyped && untyped.isEmpty()) {
                log.debug("[SCHEMA] skipping property '{}' with an empty schema", property.getKey());
                continue;
            }
            columns.add(translate(child, FieldNameSanitizer.sanitize(property.getKey()), sanitizedRequired));
        }
        return columns;
    }

    static StorageKind literalKind(LiteralType literal, String fieldName) {
        String format = literal.format() == null ? "" : literal.format();
        switch (literal.kind()) {
            case BOOLEAN:
                return StorageKind.BOOLEAN;
            case INTEGER:
                return StorageKind.INT64;
            case NUMBER:
                return switch (format) {
                    case "float" -> StorageKind.FLOAT64;
                    case "bignumeric" -> StorageKind.BIGNUMERIC;
                    default -> StorageKind.NUMERIC;
                };
            case STRING:
                return switch (format) {
                    case "date-time" -> StorageKind.TIMESTAMP;
                    case "date" -> StorageKind.DATE;
                    case "time" -> StorageKind.TIME;
                    default -> StorageKind.STRING;
                };
            default:
                throw new UnknownTypeException("unknown type: " + literal.kind().name().toLowerCase()
                        + " for field '" + fieldName + "'");
        }
    }

    private static String describe(TypeNode node) {
        if (node instanceof UntypedNode untyped) {
            return String.valueOf(untyped.raw());
        }
        return String.valueOf(node);
    }
}
