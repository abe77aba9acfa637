package org.strata.migration.operation;

import java.util.List;

public record UniqueConstraintDefinition(String name, List<String> columns) {
    public UniqueConstraintDefinition {
        columns = List.copyOf(columns);
    }
}
