package org.strata.migration.dialect.mysql;

import org.strata.migration.spi.FieldTypeMapper;
import org.strata.model.FieldModel;
import org.strata.model.FieldType;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

public class MySqlFieldTypeMapper implements FieldTypeMapper {

    /** An index over TEXT is not allowed without a prefix length. */
    static final String KEY_STRING_TYPE = "varchar(255)";
    /** Width of the prefixed ids stored in referencing columns. */
    static final String ID_STRING_TYPE = "varchar(36)";

    private static final Map<FieldType, Set<String>> ACCEPTED = Map.ofEntries(
            entry(FieldType.STRING, Set.of("varchar(255)", "varchar(36)", "varchar", "char(36)",
                    "text", "mediumtext", "longtext")),
            entry(FieldType.NUMBER, Set.of("integer", "int", "bigint", "smallint", "decimal", "float", "double")),
            entry(FieldType.BOOLEAN, Set.of("boolean", "tinyint", "tinyint(1)", "bit")),
            entry(FieldType.DATE, Set.of("timestamp", "datetime", "date")),
            entry(FieldType.TIMEZONE, Set.of("varchar(50)", "varchar")),
            entry(FieldType.JSON, Set.of("json")),
            entry(FieldType.STRING_ARRAY, Set.of("json")),
            entry(FieldType.NUMBER_ARRAY, Set.of("json"))
    );

    @Override
    public String resolveColumnType(FieldModel field) {
        return switch (field.getType()) {
            case STRING -> stringType(field);
            case BOOLEAN -> "boolean";
            case NUMBER -> field.isBigint() ? "bigint" : "integer";
            case DATE -> "datetime";
            case TIMEZONE -> "varchar(50)";
            case JSON, STRING_ARRAY, NUMBER_ARRAY -> "json";
        };
    }

    @Override
    public Set<String> acceptedTypes(FieldType type) {
        return ACCEPTED.getOrDefault(type, Set.of());
    }

    /**
     * Unique or indexed strings get a bounded varchar so the key is legal; references get the
     * fixed id width; everything else is plain text.
     */
    public static String stringType(FieldModel field) {
        if (field.isUnique()) {
            return KEY_STRING_TYPE;
        }
        if (field.hasReference()) {
            return ID_STRING_TYPE;
        }
        return field.isIndexed() ? KEY_STRING_TYPE : "text";
    }
}
