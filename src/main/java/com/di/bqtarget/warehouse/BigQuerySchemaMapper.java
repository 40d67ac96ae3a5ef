package com.di.bqtarget.warehouse;

import com.di.bqtarget.schema.ColumnDefinition;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardSQLTypeName;

import java.util.List;

/**
 * Converts translated column definitions into BigQuery {@link Schema} objects.
 */
public final class BigQuerySchemaMapper {

    private BigQuerySchemaMapper() {}

    public static Schema toSchema(List<ColumnDefinition> columns) {
        return Schema.of(toFields(columns));
    }

    public static FieldList toFields(List<ColumnDefinition> columns) {
        return FieldList.of(columns.stream().map(BigQuerySchemaMapper::toField).toList());
    }

    public static Field toField(ColumnDefinition column) {
        Field.Builder builder = column.isRecord()
                ? Field.newBuilder(column.name(), StandardSQLTypeName.STRUCT, toFields(column.fields()))
                : Field.newBuilder(column.name(), toStandardType(column));
        return builder.setMode(Field.Mode.valueOf(column.mode().name())).build();
    }

    static StandardSQLTypeName toStandardType(ColumnDefinition column) {
        return switch (column.kind()) {
            case BOOLEAN -> StandardSQLTypeName.BOOL;
            case INT64 -> StandardSQLTypeName.INT64;
            case FLOAT64 -> StandardSQLTypeName.FLOAT64;
            case NUMERIC -> StandardSQLTypeName.NUMERIC;
            case BIGNUMERIC -> StandardSQLTypeName.BIGNUMERIC;
            case STRING -> StandardSQLTypeName.STRING;
            case DATE -> StandardSQLTypeName.DATE;
            case TIME -> StandardSQLTypeName.TIME;
            case TIMESTAMP -> StandardSQLTypeName.TIMESTAMP;
            case RECORD -> StandardSQLTypeName.STRUCT;
        };
    }
}
