package org.strata.migration.contributor.create;

import org.strata.migration.contributor.TableBodyContributor;
import org.strata.migration.operation.UniqueConstraintDefinition;
import org.strata.migration.spi.dialect.DdlDialect;

import java.util.List;

public record UniqueConstraintContributor(List<UniqueConstraintDefinition> constraints) implements TableBodyContributor {
    @Override
    public int priority() {
        return 50;
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (UniqueConstraintDefinition uc : constraints) {
            sb.append("  ").append(dialect.getUniqueConstraintSql(uc)).append(",\n");
        }
    }
}
