package org.strata.migration.dialect;

import org.strata.migration.DatabaseType;
import org.strata.migration.dialect.mssql.MsSqlDialect;
import org.strata.migration.dialect.mysql.MySqlDialect;
import org.strata.migration.dialect.postgres.PostgresDialect;
import org.strata.migration.dialect.sqlite.SqliteDialect;
import org.strata.migration.spi.dialect.DdlDialect;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dialect registry. Dialects hold no state, so one instance per database is shared.
 */
public final class Dialects {

    private static final Map<DatabaseType, DdlDialect> DIALECTS = new EnumMap<>(DatabaseType.class);

    static {
        for (DatabaseType type : DatabaseType.values()) {
            DIALECTS.put(type, create(type));
        }
    }

    private Dialects() {
    }

    public static DdlDialect of(DatabaseType type) {
        return DIALECTS.get(Objects.requireNonNull(type, "databaseType"));
    }

    private static DdlDialect create(DatabaseType type) {
        return switch (type) {
            case POSTGRES -> new PostgresDialect();
            case MYSQL -> new MySqlDialect();
            case SQLITE -> new SqliteDialect();
            case MSSQL -> new MsSqlDialect();
        };
    }
}
