package org.strata.migration.dialect.mssql;

import org.strata.migration.AbstractDialect;
import org.strata.migration.DatabaseType;
import org.strata.migration.operation.ColumnDefinition;
import org.strata.migration.spi.FieldTypeMapper;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public class MsSqlDialect extends AbstractDialect {

    /** Large-object types cannot be index key columns. */
    private static final Set<String> UNKEYABLE_TYPES = Set.of("text", "ntext", "nvarchar(max)", "varchar(max)");

    @Override
    protected FieldTypeMapper initializeFieldTypeMapper() {
        return new MsSqlFieldTypeMapper();
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.MSSQL;
    }

    @Override
    public String quoteIdentifier(String raw) {
        return "[" + raw.replace("]", "]]") + "]";
    }

    @Override
    public boolean supportsKeyOn(String sqlType) {
        return sqlType == null || !UNKEYABLE_TYPES.contains(sqlType.toLowerCase(Locale.ROOT));
    }

    // T-SQL: ALTER TABLE t ADD a ..., b ...  (no COLUMN keyword)
    @Override
    public List<String> getAddColumnsSql(String table, List<ColumnDefinition> columns) {
        if (columns == null || columns.isEmpty()) return List.of();
        String defs = columns.stream()
                .map(this::getColumnDefinitionSql)
                .collect(Collectors.joining(", "));
        return List.of("ALTER TABLE " + quoteIdentifier(table) + " ADD " + defs);
    }
}
