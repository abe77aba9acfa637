package org.strata.migration.spi.dialect;

import org.strata.migration.DatabaseType;
import org.strata.migration.operation.ColumnDefinition;
import org.strata.migration.operation.IndexDefinition;
import org.strata.migration.operation.UniqueConstraintDefinition;
import org.strata.migration.spi.FieldTypeMapper;

import java.util.List;

/**
 * Renders DDL fragments for one database. Statements are returned without a trailing ';'.
 */
public interface DdlDialect {

    DatabaseType getDatabaseType();

    FieldTypeMapper getFieldTypeMapper();

    String quoteIdentifier(String identifier);

    // CREATE TABLE

    String openCreateTable(String table);

    String closeCreateTable();

    String getColumnDefinitionSql(ColumnDefinition column);

    String getUniqueConstraintSql(UniqueConstraintDefinition constraint);

    /**
     * Table-level FOREIGN KEY clause; only used when {@link #inlineReferences()} is false.
     */
    String getForeignKeyDefinitionSql(ColumnDefinition column);

    /** Whether REFERENCES is written inline in the column definition. */
    boolean inlineReferences();

    // ALTER TABLE

    /**
     * Statements adding all given columns to {@code table}. Most databases accept one
     * ALTER TABLE with several clauses.
     */
    List<String> getAddColumnsSql(String table, List<ColumnDefinition> columns);

    /** Whether ALTER TABLE ADD COLUMN accepts a UNIQUE column constraint. */
    default boolean supportsUniqueOnAddColumn() {
        return true;
    }

    // INDEX

    /**
     * Whether a plain index or unique key may cover a column of this type. Large text and JSON
     * types usually need a prefix length or cannot be keyed at all.
     */
    default boolean supportsKeyOn(String sqlType) {
        return true;
    }

    String getCreateIndexSql(String table, IndexDefinition index);
}
