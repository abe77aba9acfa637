package org.strata.migration.dialect;

import org.strata.migration.DatabaseType;
import org.strata.model.FieldModel;

/**
 * Logical field type to physical column type, per database.
 */
public final class TypeMapping {

    private TypeMapping() {
    }

    /**
     * Physical column type a field is created with on {@code db}.
     */
    public static String resolveColumnType(FieldModel field, DatabaseType db) {
        return Dialects.of(db).getFieldTypeMapper().resolveColumnType(field);
    }

    /**
     * Whether an introspected column type is an accepted spelling of the field's logical type.
     * Purely syntactic; no coercion is attempted.
     */
    public static boolean typesAreEquivalent(String liveType, FieldModel field, DatabaseType db) {
        return Dialects.of(db).getFieldTypeMapper().typesAreEquivalent(liveType, field);
    }
}
