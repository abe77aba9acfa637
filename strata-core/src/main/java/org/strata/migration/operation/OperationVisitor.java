package org.strata.migration.operation;

public interface OperationVisitor<R> {
    R visitCreateTable(CreateTableOperation operation);

    R visitAddColumns(AddColumnsOperation operation);
}
