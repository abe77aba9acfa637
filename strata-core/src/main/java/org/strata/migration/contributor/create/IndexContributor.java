package org.strata.migration.contributor.create;

import org.strata.migration.contributor.StatementContributor;
import org.strata.migration.operation.IndexDefinition;
import org.strata.migration.spi.dialect.DdlDialect;

import java.util.List;

public record IndexContributor(String table, List<IndexDefinition> indexes) implements StatementContributor {
    @Override
    public int priority() {
        return 60;
    }

    @Override
    public List<String> statements(DdlDialect dialect) {
        return indexes.stream()
                .map(idx -> dialect.getCreateIndexSql(table, idx))
                .toList();
    }
}
