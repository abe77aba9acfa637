package org.strata.migration.dialect.mysql;

import org.strata.migration.AbstractDialect;
import org.strata.migration.DatabaseType;
import org.strata.migration.operation.ColumnDefinition;
import org.strata.migration.spi.FieldTypeMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * InnoDB parses but ignores column-level REFERENCES, so foreign keys are always written as
 * separate FOREIGN KEY clauses.
 */
public class MySqlDialect extends AbstractDialect {

    /** Keys over these need a prefix length, which is never generated. */
    private static final Set<String> UNKEYABLE_TYPES = Set.of("text", "mediumtext", "longtext", "json");

    @Override
    protected FieldTypeMapper initializeFieldTypeMapper() {
        return new MySqlFieldTypeMapper();
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.MYSQL;
    }

    @Override
    public String quoteIdentifier(String raw) {
        return "`" + raw.replace("`", "``") + "`";
    }

    @Override
    public String closeCreateTable() {
        return "\n) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4";
    }

    @Override
    public boolean supportsKeyOn(String sqlType) {
        return sqlType == null || !UNKEYABLE_TYPES.contains(sqlType.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean inlineReferences() {
        return false;
    }

    @Override
    public List<String> getAddColumnsSql(String table, List<ColumnDefinition> columns) {
        if (columns == null || columns.isEmpty()) return List.of();
        List<String> clauses = new ArrayList<>();
        for (ColumnDefinition c : columns) {
            clauses.add("ADD COLUMN " + getColumnDefinitionSql(c));
        }
        for (ColumnDefinition c : columns) {
            if (c.hasReference()) {
                clauses.add("ADD " + getForeignKeyDefinitionSql(c));
            }
        }
        return List.of("ALTER TABLE " + quoteIdentifier(table) + " " + String.join(", ", clauses));
    }
}
