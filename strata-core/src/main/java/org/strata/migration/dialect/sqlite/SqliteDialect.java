package org.strata.migration.dialect.sqlite;

import org.strata.migration.AbstractDialect;
import org.strata.migration.DatabaseType;
import org.strata.migration.operation.ColumnDefinition;
import org.strata.migration.spi.FieldTypeMapper;

import java.util.List;

/**
 * SQLite allows a single ADD COLUMN per ALTER TABLE and rejects UNIQUE on added columns;
 * uniqueness of added columns is enforced by a unique index instead.
 */
public class SqliteDialect extends AbstractDialect {

    @Override
    protected FieldTypeMapper initializeFieldTypeMapper() {
        return new SqliteFieldTypeMapper();
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.SQLITE;
    }

    @Override
    public String quoteIdentifier(String raw) {
        return "\"" + raw.replace("\"", "\"\"") + "\"";
    }

    @Override
    public List<String> getAddColumnsSql(String table, List<ColumnDefinition> columns) {
        if (columns == null) return List.of();
        return columns.stream()
                .map(c -> "ALTER TABLE " + quoteIdentifier(table) + " ADD COLUMN " + getColumnDefinitionSql(c))
                .toList();
    }

    @Override
    public boolean supportsUniqueOnAddColumn() {
        return false;
    }
}
