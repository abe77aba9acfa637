package org.strata.migration.dialect.sqlite;

import org.strata.migration.spi.FieldTypeMapper;
import org.strata.model.FieldModel;
import org.strata.model.FieldType;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * SQLite has no boolean or JSON storage class; both fall back to integer / text.
 */
public class SqliteFieldTypeMapper implements FieldTypeMapper {

    private static final Map<FieldType, Set<String>> ACCEPTED = Map.ofEntries(
            entry(FieldType.STRING, Set.of("text")),
            entry(FieldType.NUMBER, Set.of("integer", "int", "bigint", "real")),
            entry(FieldType.BOOLEAN, Set.of("integer", "boolean")),
            entry(FieldType.DATE, Set.of("date", "datetime", "timestamp", "integer")),
            entry(FieldType.TIMEZONE, Set.of("text")),
            entry(FieldType.JSON, Set.of("text")),
            entry(FieldType.STRING_ARRAY, Set.of("text")),
            entry(FieldType.NUMBER_ARRAY, Set.of("text"))
    );

    @Override
    public String resolveColumnType(FieldModel field) {
        return switch (field.getType()) {
            case STRING, TIMEZONE, JSON, STRING_ARRAY, NUMBER_ARRAY -> "text";
            case BOOLEAN -> "integer";
            case NUMBER -> field.isBigint() ? "bigint" : "integer";
            case DATE -> "date";
        };
    }

    @Override
    public Set<String> acceptedTypes(FieldType type) {
        return ACCEPTED.getOrDefault(type, Set.of());
    }
}
