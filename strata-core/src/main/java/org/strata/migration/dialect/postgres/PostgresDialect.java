package org.strata.migration.dialect.postgres;

import org.strata.migration.AbstractDialect;
import org.strata.migration.DatabaseType;
import org.strata.migration.spi.FieldTypeMapper;

public class PostgresDialect extends AbstractDialect {

    @Override
    protected FieldTypeMapper initializeFieldTypeMapper() {
        return new PostgresFieldTypeMapper();
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.POSTGRES;
    }

    @Override
    public String quoteIdentifier(String raw) {
        return "\"" + raw.replace("\"", "\"\"") + "\"";
    }
}
