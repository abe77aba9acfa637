package org.strata.migration;

import lombok.Getter;

/**
 * A table declares its own {@code id} column, which collides with the synthetic primary key.
 */
@Getter
public class IdColumnConflictException extends SchemaConfigurationException {
    private final String table;

    public IdColumnConflictException(String table) {
        super("Table '" + table + "' declares a field mapped to column 'id', which is reserved for the generated primary key");
        this.table = table;
    }
}
