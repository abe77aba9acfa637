package org.strata.migration.dialect.mssql;

import org.strata.migration.dialect.mysql.MySqlFieldTypeMapper;
import org.strata.migration.spi.FieldTypeMapper;
import org.strata.model.FieldModel;
import org.strata.model.FieldType;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * SQL Server stores JSON in {@code nvarchar(max)}; booleans in {@code smallint}.
 */
public class MsSqlFieldTypeMapper implements FieldTypeMapper {

    private static final Map<FieldType, Set<String>> ACCEPTED = Map.ofEntries(
            entry(FieldType.STRING, Set.of("text", "ntext", "varchar", "varchar(255)", "varchar(36)", "nvarchar")),
            entry(FieldType.NUMBER, Set.of("int", "integer", "bigint", "smallint", "decimal",
                    "float", "float(53)", "float(24)")),
            entry(FieldType.BOOLEAN, Set.of("bit", "smallint")),
            entry(FieldType.DATE, Set.of("datetime", "datetime2", "date")),
            entry(FieldType.TIMEZONE, Set.of("varchar", "text", "nvarchar", "nvarchar(50)")),
            entry(FieldType.JSON, Set.of("nvarchar(max)", "nvarchar")),
            entry(FieldType.STRING_ARRAY, Set.of("nvarchar(max)", "nvarchar")),
            entry(FieldType.NUMBER_ARRAY, Set.of("nvarchar(max)", "nvarchar"))
    );

    @Override
    public String resolveColumnType(FieldModel field) {
        return switch (field.getType()) {
            case STRING -> MySqlFieldTypeMapper.stringType(field);
            case BOOLEAN -> "smallint";
            case NUMBER -> field.isBigint() ? "bigint" : "integer";
            case DATE -> "datetime";
            case TIMEZONE -> "nvarchar(50)";
            case JSON, STRING_ARRAY, NUMBER_ARRAY -> "nvarchar(max)";
        };
    }

    @Override
    public Set<String> acceptedTypes(FieldType type) {
        return ACCEPTED.getOrDefault(type, Set.of());
    }
}
