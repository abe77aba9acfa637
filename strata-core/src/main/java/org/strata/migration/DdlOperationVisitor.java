package org.strata.migration;

import org.strata.migration.operation.AddColumnsOperation;
import org.strata.migration.operation.CreateTableOperation;
import org.strata.migration.operation.OperationVisitor;
import org.strata.migration.spi.dialect.DdlDialect;

import java.util.List;

/**
 * Turns one operation into the statements that implement it on a given dialect.
 */
public class DdlOperationVisitor implements OperationVisitor<List<String>> {
    private final DdlDialect dialect;

    public DdlOperationVisitor(DdlDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public List<String> visitCreateTable(CreateTableOperation operation) {
        return new CreateTableBuilder(operation.table(), dialect).defaultsFrom(operation).build();
    }

    @Override
    public List<String> visitAddColumns(AddColumnsOperation operation) {
        return new AlterTableBuilder(operation.table(), dialect).defaultsFrom(operation).build();
    }
}
