package org.strata.migration;

/**
 * The desired schema cannot be turned into DDL as declared. Raised before any SQL is generated.
 */
public class SchemaConfigurationException extends RuntimeException {
    public SchemaConfigurationException(String message) {
        super(message);
    }
}
