package org.strata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Database-agnostic type of a field. The physical column type is chosen per dialect.
 */
public enum FieldType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    DATE("date"),
    TIMEZONE("timezone"),
    JSON("json"),
    STRING_ARRAY("string[]"),
    NUMBER_ARRAY("number[]");

    private final String wireName;

    FieldType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Arrays are always stored as serialized JSON, never as native array columns.
     */
    public boolean isArray() {
        return this == STRING_ARRAY || this == NUMBER_ARRAY;
    }

    @JsonCreator
    public static FieldType fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("field type must not be null/blank");
        }
        String t = raw.trim().toLowerCase(Locale.ROOT);
        for (FieldType type : values()) {
            if (type.wireName.equals(t) || type.name().toLowerCase(Locale.ROOT).equals(t)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + raw);
    }
}
