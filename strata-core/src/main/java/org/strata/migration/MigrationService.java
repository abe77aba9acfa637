package org.strata.migration;

import lombok.extern.slf4j.Slf4j;
import org.strata.migration.differs.SchemaDiffer;
import org.strata.migration.jdbc.JdbcSchemaIntrospector;
import org.strata.migration.jdbc.JdbcSqlExecutor;
import org.strata.migration.spi.SchemaIntrospector;
import org.strata.migration.spi.SqlExecutor;
import org.strata.model.CanonicalSchema;
import org.strata.model.DiffResult;
import org.strata.model.LiveTableMetadata;
import org.strata.model.TableFragment;
import org.strata.naming.DefaultNaming;
import org.strata.naming.Naming;
import org.strata.schema.SchemaAssembler;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Entry point for planning a migration against a live database:
 * assemble → introspect → diff → build plan.
 */
@Slf4j
public class MigrationService {
    private final SchemaAssembler assembler;
    private final SchemaIntrospector introspector;
    private final Naming naming;

    public MigrationService() {
        this(new SchemaAssembler(), new JdbcSchemaIntrospector(), new DefaultNaming());
    }

    public MigrationService(Naming naming) {
        this(new SchemaAssembler(), new JdbcSchemaIntrospector(), naming);
    }

    public MigrationService(SchemaAssembler assembler, SchemaIntrospector introspector, Naming naming) {
        this.assembler = assembler;
        this.introspector = introspector;
        this.naming = naming;
    }

    /**
     * Plans the migration of the database behind {@code connection}.
     *
     * @param databaseType dialect to use; detected from the connection when {@code null}
     * @throws MigrationCapabilityException when there is no connection or it cannot be introspected
     * @throws SchemaConfigurationException when the schema cannot be expressed as DDL
     */
    public MigrationResult plan(Connection connection, List<TableFragment> fragments, DatabaseType databaseType) {
        if (connection == null) {
            throw new MigrationCapabilityException("No database connection available; cannot introspect the live schema");
        }
        DatabaseType db = databaseType != null ? databaseType : detect(connection);

        List<LiveTableMetadata> live;
        try {
            live = introspector.introspect(connection);
        } catch (SQLException e) {
            throw new MigrationCapabilityException("Failed to introspect database: " + e.getMessage(), e);
        }
        return plan(assembler.assemble(fragments), live, db, new JdbcSqlExecutor(connection));
    }

    /**
     * Pure planning step for an already assembled schema and introspected tables.
     */
    public MigrationResult plan(CanonicalSchema schema, List<LiveTableMetadata> live,
                                DatabaseType databaseType, SqlExecutor sqlExecutor) {
        DiffResult diff = new SchemaDiffer(databaseType).diff(schema, live);
        MigrationPlan plan = new MigrationPlanBuilder(databaseType, naming).build(diff);
        log.debug("Planned {} operation(s) for {}", plan.operations().size(), databaseType);
        return new MigrationResult(diff, plan, new MigrationExecutor(databaseType), sqlExecutor);
    }

    /**
     * Dialect from the JDBC product name. Unknown products are treated as SQLite.
     */
    public static DatabaseType detect(Connection connection) {
        String product = productName(connection);
        return DatabaseType.fromProductName(product).orElseGet(() -> {
            log.warn("Unsupported database '{}'; falling back to {}", product, DatabaseType.SQLITE);
            return DatabaseType.SQLITE;
        });
    }

    private static String productName(Connection connection) {
        try {
            return connection.getMetaData().getDatabaseProductName();
        } catch (SQLException e) {
            throw new MigrationCapabilityException("Cannot read database metadata: " + e.getMessage(), e);
        }
    }
}
