package org.strata.migration.dialect.postgres;

import org.strata.migration.spi.FieldTypeMapper;
import org.strata.model.FieldModel;
import org.strata.model.FieldType;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

public class PostgresFieldTypeMapper implements FieldTypeMapper {

    private static final Map<FieldType, Set<String>> ACCEPTED = Map.ofEntries(
            entry(FieldType.STRING, Set.of("character varying", "varchar", "text")),
            entry(FieldType.NUMBER, Set.of("int4", "integer", "int8", "bigint", "int2", "smallint",
                    "numeric", "real", "double precision", "float4", "float8")),
            entry(FieldType.BOOLEAN, Set.of("bool", "boolean")),
            entry(FieldType.DATE, Set.of("timestamp", "timestamp without time zone", "timestamptz",
                    "timestamp with time zone", "date")),
            entry(FieldType.TIMEZONE, Set.of("text", "character varying", "varchar")),
            entry(FieldType.JSON, Set.of("json", "jsonb")),
            entry(FieldType.STRING_ARRAY, Set.of("json", "jsonb")),
            entry(FieldType.NUMBER_ARRAY, Set.of("json", "jsonb"))
    );

    @Override
    public String resolveColumnType(FieldModel field) {
        return switch (field.getType()) {
            case STRING, TIMEZONE -> "text";
            case BOOLEAN -> "boolean";
            case NUMBER -> field.isBigint() ? "bigint" : "integer";
            case DATE -> "timestamp";
            case JSON, STRING_ARRAY, NUMBER_ARRAY -> "jsonb";
        };
    }

    @Override
    public Set<String> acceptedTypes(FieldType type) {
        return ACCEPTED.getOrDefault(type, Set.of());
    }
}
