package org.strata.model;

/**
 * A column as reported by the database, with its native type spelling.
 */
public record LiveColumnMetadata(String name, String dataType) {
}
