package org.strata.migration.operation;

import java.util.List;

/**
 * One step of a migration plan. Only additive operations exist.
 */
public sealed interface MigrationOperation permits CreateTableOperation, AddColumnsOperation {

    String table();

    List<ColumnDefinition> columns();

    int order();

    <R> R accept(OperationVisitor<R> visitor);
}
