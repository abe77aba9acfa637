package org.strata.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The assembled desired schema: physical table name → definition.
 */
public class CanonicalSchema {

    private final Map<String, TableDefinition> tables;

    public CanonicalSchema(Map<String, TableDefinition> tables) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public static CanonicalSchema empty() {
        return new CanonicalSchema(Map.of());
    }

    public Map<String, TableDefinition> getTables() {
        return tables;
    }

    public Optional<TableDefinition> findTable(String tableName) {
        return Optional.ofNullable(tables.get(tableName));
    }

    public int size() {
        return tables.size();
    }
}
