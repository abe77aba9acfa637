package org.strata.cli.service;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens JDBC connections through {@link DriverManager}; drivers are found on the classpath.
 */
public class DatabaseConnector {

    public Connection open(String url, String user, String password) throws SQLException {
        Properties props = new Properties();
        if (user != null) props.setProperty("user", user);
        if (password != null) props.setProperty("password", password);
        return DriverManager.getConnection(url, props);
    }
}
