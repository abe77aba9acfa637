package org.strata.migration.operation;

import java.util.List;

/**
 * Standalone {@code CREATE [UNIQUE] INDEX}, issued after the table or column exists.
 */
public record IndexDefinition(String name, List<String> columns, boolean unique) {
    public IndexDefinition {
        columns = List.copyOf(columns);
    }
}
