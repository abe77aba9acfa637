package org.strata.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Assembled definition of one physical table. {@code fields} is keyed by column name and keeps
 * declaration order, which is also the column order of a created table.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TableDefinition {
    /** Order of tables that did not declare one; they are created last. */
    public static final int UNORDERED = Integer.MAX_VALUE;

    private String tableName;

    @Builder.Default
    private LinkedHashMap<String, FieldModel> fields = new LinkedHashMap<>();

    @Builder.Default
    private int order = UNORDERED;

    @Builder.Default
    private List<UniqueConstraintModel> uniqueConstraints = new ArrayList<>();

    @Builder.Default
    private List<IndexModel> indexes = new ArrayList<>();
}
