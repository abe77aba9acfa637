package org.strata.model;

import java.util.List;
import java.util.Optional;

/**
 * Introspected structure of one existing table. Read-only ground truth.
 */
public record LiveTableMetadata(String name, List<LiveColumnMetadata> columns) {

    public LiveTableMetadata {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static LiveTableMetadata of(String name, LiveColumnMetadata... columns) {
        return new LiveTableMetadata(name, List.of(columns));
    }

    public Optional<LiveColumnMetadata> findColumn(String columnName) {
        return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
    }
}
