package org.strata.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Records whether a field has a default and of which kind.
 * <p>
 * The value is never evaluated while planning migrations. Static and computed defaults are
 * applied by whoever inserts rows; DDL only ever carries NOT NULL / nullable.
 */
@JsonDeserialize(using = DefaultValuePolicyDeserializer.class)
public sealed interface DefaultValuePolicy
        permits DefaultValuePolicy.None, DefaultValuePolicy.Static, DefaultValuePolicy.Computed {

    None NONE = new None();

    static DefaultValuePolicy none() {
        return NONE;
    }

    static DefaultValuePolicy of(Object value) {
        return value == null ? NONE : new Static(value);
    }

    static DefaultValuePolicy computed(ComputedDefault kind) {
        return new Computed(kind);
    }

    default boolean isPresent() {
        return !(this instanceof None);
    }

    record None() implements DefaultValuePolicy {
    }

    record Static(Object value) implements DefaultValuePolicy {
    }

    record Computed(ComputedDefault kind) implements DefaultValuePolicy {
        public Computed {
            if (kind == null) {
                throw new IllegalArgumentException("computed default kind must not be null");
            }
        }
    }
}
