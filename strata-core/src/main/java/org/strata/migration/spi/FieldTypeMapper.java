package org.strata.migration.spi;

import org.strata.model.FieldModel;
import org.strata.model.FieldType;

import java.util.Locale;
import java.util.Set;

/**
 * Dialect-specific type knowledge: which native type a field is created with, and which native
 * spellings count as "the same" logical type when found in a live database.
 */
public interface FieldTypeMapper {

    String resolveColumnType(FieldModel field);

    /**
     * Lower-case native spellings accepted for a logical type.
     */
    Set<String> acceptedTypes(FieldType type);

    /**
     * Syntactic compatibility check between a live column type and a field. Never a coercion:
     * {@code false} only means the difference is worth a warning.
     */
    default boolean typesAreEquivalent(String liveType, FieldModel field) {
        if (liveType == null || field == null || field.getType() == null) {
            return false;
        }
        String live = liveType.trim().toLowerCase(Locale.ROOT);
        if (field.getType().isArray()) {
            return live.contains("json") || acceptedTypes(FieldType.JSON).contains(live);
        }
        return acceptedTypes(field.getType()).contains(live);
    }
}
