package org.strata.migration.contributor.alter;

import org.strata.migration.contributor.StatementContributor;
import org.strata.migration.operation.ColumnDefinition;
import org.strata.migration.spi.dialect.DdlDialect;

import java.util.List;

public record ColumnAddContributor(String table, List<ColumnDefinition> columns) implements StatementContributor {
    @Override
    public int priority() {
        return 40;
    }

    @Override
    public List<String> statements(DdlDialect dialect) {
        return dialect.getAddColumnsSql(table, columns);
    }
}
