package org.strata.migration;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of supported SQL dialects. Code that branches on a dialect switches over this enum
 * exhaustively, so adding a constant is a compile-visible change.
 */
public enum DatabaseType {
    POSTGRES,
    MYSQL,
    SQLITE,
    MSSQL;

    /**
     * Parses a user-facing dialect name ({@code postgres}, {@code postgresql}, {@code mysql},
     * {@code mariadb}, {@code sqlite}, {@code mssql}, {@code sqlserver}).
     */
    public static DatabaseType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dialect name must not be null/blank");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "postgres", "postgresql", "pg" -> POSTGRES;
            case "mysql", "mariadb" -> MYSQL;
            case "sqlite", "sqlite3" -> SQLITE;
            case "mssql", "sqlserver", "sql-server" -> MSSQL;
            default -> throw new IllegalArgumentException("Unsupported dialect: " + name);
        };
    }

    /**
     * Maps a JDBC {@code DatabaseMetaData#getDatabaseProductName()} value to a dialect.
     */
    public static Optional<DatabaseType> fromProductName(String productName) {
        if (productName == null) {
            return Optional.empty();
        }
        String p = productName.toLowerCase(Locale.ROOT);
        if (p.contains("postgres")) return Optional.of(POSTGRES);
        if (p.contains("mysql") || p.contains("mariadb")) return Optional.of(MYSQL);
        if (p.contains("sqlite")) return Optional.of(SQLITE);
        if (p.contains("sql server")) return Optional.of(MSSQL);
        return Optional.empty();
    }
}
