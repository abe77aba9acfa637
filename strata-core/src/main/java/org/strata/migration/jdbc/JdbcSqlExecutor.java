package org.strata.migration.jdbc;

import org.strata.migration.spi.SqlExecutor;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public class JdbcSqlExecutor implements SqlExecutor {
    private final Connection connection;

    public JdbcSqlExecutor(Connection connection) {
        this.connection = connection;
    }

    @Override
    public void execute(String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }
}
