package org.strata.migration.contributor.create;

import org.strata.migration.contributor.TableBodyContributor;
import org.strata.migration.operation.ColumnDefinition;
import org.strata.migration.spi.dialect.DdlDialect;

import java.util.List;

public record ColumnContributor(List<ColumnDefinition> columns) implements TableBodyContributor {
    @Override
    public int priority() {
        return 40;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (ColumnDefinition c : columns) {
            sb.append("  ").append(dialect.getColumnDefinitionSql(c)).append(",\n");
        }
    }
}
