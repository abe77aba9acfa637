package org.strata.migration.spi;

import org.strata.model.LiveTableMetadata;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Reads the tables and columns that currently exist behind a connection.
 */
@FunctionalInterface
public interface SchemaIntrospector {
    List<LiveTableMetadata> introspect(Connection connection) throws SQLException;
}
