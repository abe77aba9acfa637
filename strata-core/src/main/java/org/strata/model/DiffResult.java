package org.strata.model;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Outcome of comparing the desired schema with the live database.
 * Contains only additive changes; nothing here ever drops or retypes.
 */
@Builder
@Getter
public class DiffResult {
    @Builder.Default private List<TableToCreate> tablesToCreate = new ArrayList<>();
    @Builder.Default private List<ColumnsToAdd> columnsToAdd = new ArrayList<>();
    @Builder.Default private List<TypeMismatch> typeMismatches = new ArrayList<>();
    @Builder.Default private List<String> warnings = new ArrayList<>();

    public boolean hasChanges() {
        return !tablesToCreate.isEmpty() || !columnsToAdd.isEmpty();
    }

    @Builder
    @Getter
    public static class TableToCreate {
        private String table;
        @Builder.Default private LinkedHashMap<String, FieldModel> fields = new LinkedHashMap<>();
        private int order;
        @Builder.Default private List<UniqueConstraintModel> uniqueConstraints = new ArrayList<>();
        @Builder.Default private List<IndexModel> indexes = new ArrayList<>();
    }

    @Builder
    @Getter
    public static class ColumnsToAdd {
        private String table;
        @Builder.Default private LinkedHashMap<String, FieldModel> fields = new LinkedHashMap<>();
        private int order;
    }

    @Builder
    @Getter
    public static class TypeMismatch {
        private String table;
        private String column;
        private FieldType expected;
        private String actual;
    }
}
