package org.strata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReferentialAction {
    CASCADE("CASCADE"),
    SET_NULL("SET NULL"),
    RESTRICT("RESTRICT"),
    NO_ACTION("NO ACTION");

    private final String sql;

    ReferentialAction(String sql) {
        this.sql = sql;
    }

    @JsonValue
    public String sql() {
        return sql;
    }

    @JsonCreator
    public static ReferentialAction fromSql(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String t = raw.trim().replace('_', ' ').toUpperCase(Locale.ROOT);
        for (ReferentialAction action : values()) {
            if (action.sql.equals(t)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown referential action: " + raw);
    }
}
