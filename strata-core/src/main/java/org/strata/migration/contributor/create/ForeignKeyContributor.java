package org.strata.migration.contributor.create;

import org.strata.migration.contributor.TableBodyContributor;
import org.strata.migration.operation.ColumnDefinition;
import org.strata.migration.spi.dialect.DdlDialect;

import java.util.List;

/**
 * Table-level FOREIGN KEY clauses, for dialects that do not honour inline REFERENCES.
 */
public record ForeignKeyContributor(List<ColumnDefinition> columns) implements TableBodyContributor {
    @Override
    public int priority() {
        return 55;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        if (dialect.inlineReferences()) return;
        for (ColumnDefinition c : columns) {
            if (c.hasReference()) {
                sb.append("  ").append(dialect.getForeignKeyDefinitionSql(c)).append(",\n");
            }
        }
    }
}
