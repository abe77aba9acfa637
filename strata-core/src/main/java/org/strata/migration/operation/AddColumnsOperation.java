package org.strata.migration.operation;

import java.util.List;

public record AddColumnsOperation(
        String table,
        List<ColumnDefinition> columns,
        List<IndexDefinition> indexes,
        int order
) implements MigrationOperation {

    public AddColumnsOperation {
        columns = List.copyOf(columns);
        indexes = indexes == null ? List.of() : List.copyOf(indexes);
    }

    public AddColumnsOperation(String table, List<ColumnDefinition> columns, int order) {
        this(table, columns, List.of(), order);
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDefinition::getName).toList();
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitAddColumns(this);
    }
}
