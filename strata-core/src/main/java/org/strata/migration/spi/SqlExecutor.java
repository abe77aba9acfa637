package org.strata.migration.spi;

import java.sql.SQLException;

/**
 * Executes one DDL statement against the target database.
 */
@FunctionalInterface
public interface SqlExecutor {
    void execute(String sql) throws SQLException;
}
