package org.strata.migration;

import lombok.Getter;
import org.strata.migration.contributor.StatementContributor;
import org.strata.migration.contributor.SqlContributor;
import org.strata.migration.contributor.alter.ColumnAddContributor;
import org.strata.migration.contributor.create.IndexContributor;
import org.strata.migration.operation.AddColumnsOperation;
import org.strata.migration.spi.dialect.DdlDialect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class AlterTableBuilder {
    @Getter
    private final String tableName;
    @Getter
    private final DdlDialect dialect;
    @Getter
    private final List<StatementContributor> units = new ArrayList<>();

    public AlterTableBuilder(String tableName, DdlDialect dialect) {
        this.tableName = tableName;
        this.dialect = dialect;
    }

    public AlterTableBuilder add(StatementContributor unit) {
        units.add(unit);
        return this;
    }

    public AlterTableBuilder defaultsFrom(AddColumnsOperation op) {
        this.add(new ColumnAddContributor(op.table(), op.columns()));
        this.add(new IndexContributor(op.table(), op.indexes()));
        return this;
    }

    public List<String> build() {
        List<String> statements = new ArrayList<>();
        units.stream()
                .sorted(Comparator.comparingInt(SqlContributor::priority))
                .forEach(c -> statements.addAll(c.statements(dialect)));
        return statements;
    }
}
