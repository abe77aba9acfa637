package org.strata.migration;

/**
 * No usable connection, or the database cannot be introspected. Nothing is planned.
 */
public class MigrationCapabilityException extends RuntimeException {
    public MigrationCapabilityException(String message) {
        super(message);
    }

    public MigrationCapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
