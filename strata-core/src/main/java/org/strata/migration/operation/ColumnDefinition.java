package org.strata.migration.operation;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.strata.model.ReferentialAction;

/**
 * A column with its dialect type already resolved; what the DDL renderers consume.
 */
@Getter
@Builder
@ToString
public class ColumnDefinition {
    private final String name;
    private final String sqlType;
    private final boolean primaryKey;
    private final boolean notNull;
    private final boolean unique;
    private final String referencedTable;
    private final String referencedColumn;
    private final ReferentialAction onDelete;

    public boolean hasReference() {
        return referencedTable != null;
    }

    public ColumnDefinition withoutUnique() {
        return ColumnDefinition.builder()
                .name(name)
                .sqlType(sqlType)
                .primaryKey(primaryKey)
                .notNull(notNull)
                .unique(false)
                .referencedTable(referencedTable)
                .referencedColumn(referencedColumn)
                .onDelete(onDelete)
                .build();
    }
}
