package org.strata.migration.operation;

import java.util.List;

/**
 * {@code columns} starts with the synthetic primary key, followed by the declared fields in
 * declaration order.
 */
public record CreateTableOperation(
        String table,
        List<ColumnDefinition> columns,
        List<UniqueConstraintDefinition> uniqueConstraints,
        List<IndexDefinition> indexes,
        int order
) implements MigrationOperation {

    public CreateTableOperation {
        columns = List.copyOf(columns);
        uniqueConstraints = uniqueConstraints == null ? List.of() : List.copyOf(uniqueConstraints);
        indexes = indexes == null ? List.of() : List.copyOf(indexes);
    }

    public CreateTableOperation(String table, List<ColumnDefinition> columns, int order) {
        this(table, columns, List.of(), List.of(), order);
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitCreateTable(this);
    }
}
