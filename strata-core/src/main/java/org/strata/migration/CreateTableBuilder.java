package org.strata.migration;

import org.strata.migration.contributor.SqlContributor;
import org.strata.migration.contributor.StatementContributor;
import org.strata.migration.contributor.TableBodyContributor;
import org.strata.migration.contributor.create.ColumnContributor;
import org.strata.migration.contributor.create.ForeignKeyContributor;
import org.strata.migration.contributor.create.IndexContributor;
import org.strata.migration.contributor.create.UniqueConstraintContributor;
import org.strata.migration.operation.CreateTableOperation;
import org.strata.migration.spi.dialect.DdlDialect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Assembles the CREATE TABLE statement followed by the statements that need the table to exist.
 */
public class CreateTableBuilder {
    private final String table;
    private final DdlDialect dialect;
    private final List<TableBodyContributor> body = new ArrayList<>();
    private final List<StatementContributor> post = new ArrayList<>();

    public CreateTableBuilder(String table, DdlDialect dialect) {
        this.table = table;
        this.dialect = dialect;
    }

    public CreateTableBuilder add(SqlContributor c) {
        if (c instanceof TableBodyContributor b) {
            body.add(b);
        } else if (c instanceof StatementContributor s) {
            post.add(s);
        } else {
            throw new IllegalArgumentException("Unsupported contributor type: " + c.getClass().getName());
        }
        return this;
    }

    public CreateTableBuilder defaultsFrom(CreateTableOperation op) {
        this.add(new ColumnContributor(op.columns()));
        this.add(new UniqueConstraintContributor(op.uniqueConstraints()));
        this.add(new ForeignKeyContributor(op.columns()));
        this.add(new IndexContributor(op.table(), op.indexes()));
        return this;
    }

    public List<String> build() {
        StringBuilder sb = new StringBuilder(dialect.openCreateTable(table));

        body.stream()
                .sorted(Comparator.comparingInt(SqlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        trimTrailingComma(sb);
        sb.append(dialect.closeCreateTable());

        List<String> statements = new ArrayList<>();
        statements.add(sb.toString());
        post.stream()
                .sorted(Comparator.comparingInt(SqlContributor::priority))
                .forEach(c -> statements.addAll(c.statements(dialect)));
        return statements;
    }

    private void trimTrailingComma(StringBuilder sb) {
        int last = sb.lastIndexOf(",\n");
        if (last != -1 && last == sb.length() - 2) sb.delete(last, last + 2);
    }
}
