package org.strata.migration;

import org.strata.migration.operation.ColumnDefinition;
import org.strata.migration.operation.IndexDefinition;
import org.strata.migration.operation.UniqueConstraintDefinition;
import org.strata.migration.spi.FieldTypeMapper;
import org.strata.migration.spi.dialect.DdlDialect;

import java.util.List;
import java.util.stream.Collectors;

public abstract class AbstractDialect implements DdlDialect {
    protected FieldTypeMapper fieldTypeMapper;

    protected AbstractDialect() {
        this.fieldTypeMapper = initializeFieldTypeMapper();
    }

    protected abstract FieldTypeMapper initializeFieldTypeMapper();

    @Override
    public abstract String quoteIdentifier(String identifier);

    @Override
    public FieldTypeMapper getFieldTypeMapper() {
        return fieldTypeMapper;
    }

    @Override
    public String openCreateTable(String table) {
        return "CREATE TABLE " + quoteIdentifier(table) + " (\n";
    }

    @Override
    public String closeCreateTable() {
        return "\n)";
    }

    @Override
    public String getColumnDefinitionSql(ColumnDefinition c) {
        StringBuilder sb = new StringBuilder()
                .append(quoteIdentifier(c.getName()))
                .append(' ')
                .append(c.getSqlType());
        if (c.isPrimaryKey()) {
            sb.append(" NOT NULL PRIMARY KEY");
            return sb.toString();
        }
        if (c.isNotNull()) {
            sb.append(" NOT NULL");
        }
        if (c.isUnique()) {
            sb.append(" UNIQUE");
        }
        if (c.hasReference() && inlineReferences()) {
            sb.append(' ').append(referencesClause(c));
        }
        return sb.toString();
    }

    @Override
    public String getUniqueConstraintSql(UniqueConstraintDefinition uc) {
        return "CONSTRAINT " + quoteIdentifier(uc.name()) + " UNIQUE (" + quoteColumns(uc.columns()) + ")";
    }

    @Override
    public String getForeignKeyDefinitionSql(ColumnDefinition c) {
        return "FOREIGN KEY (" + quoteIdentifier(c.getName()) + ") " + referencesClause(c);
    }

    @Override
    public boolean inlineReferences() {
        return true;
    }

    /**
     * One {@code ALTER TABLE} carrying an {@code ADD COLUMN} clause per column.
     */
    @Override
    public List<String> getAddColumnsSql(String table, List<ColumnDefinition> columns) {
        if (columns == null || columns.isEmpty()) return List.of();
        String clauses = columns.stream()
                .map(c -> "ADD COLUMN " + getColumnDefinitionSql(c))
                .collect(Collectors.joining(", "));
        return List.of("ALTER TABLE " + quoteIdentifier(table) + " " + clauses);
    }

    @Override
    public String getCreateIndexSql(String table, IndexDefinition index) {
        return "CREATE " + (index.unique() ? "UNIQUE " : "") + "INDEX " + quoteIdentifier(index.name())
                + " ON " + quoteIdentifier(table) + " (" + quoteColumns(index.columns()) + ")";
    }

    protected String referencesClause(ColumnDefinition c) {
        String sql = "REFERENCES " + quoteIdentifier(c.getReferencedTable())
                + "(" + quoteIdentifier(c.getReferencedColumn()) + ")";
        if (c.getOnDelete() != null) {
            sql += " ON DELETE " + c.getOnDelete().sql();
        }
        return sql;
    }

    protected String quoteColumns(List<String> columns) {
        return columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
    }
}
