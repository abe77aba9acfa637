package org.strata.migration;

import org.strata.migration.operation.AddColumnsOperation;
import org.strata.migration.operation.CreateTableOperation;
import org.strata.migration.operation.MigrationOperation;

import java.util.List;

/**
 * Ordered operations for one database. Computed fresh on every run; nothing is persisted.
 */
public record MigrationPlan(DatabaseType databaseType, List<MigrationOperation> operations) {

    public MigrationPlan {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public List<CreateTableOperation> createTableOperations() {
        return operations.stream()
                .filter(CreateTableOperation.class::isInstance)
                .map(CreateTableOperation.class::cast)
                .toList();
    }

    public List<AddColumnsOperation> addColumnsOperations() {
        return operations.stream()
                .filter(AddColumnsOperation.class::isInstance)
                .map(AddColumnsOperation.class::cast)
                .toList();
    }
}
