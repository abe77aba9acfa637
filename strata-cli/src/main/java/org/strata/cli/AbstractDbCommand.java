package org.strata.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.cli.service.DatabaseConnector;
import org.strata.cli.service.SchemaIoService;
import org.strata.config.ConfigurationLoader;
import org.strata.migration.DatabaseType;
import org.strata.migration.MigrationResult;
import org.strata.migration.MigrationService;
import org.strata.model.TableFragment;
import org.strata.naming.DefaultNaming;
import org.strata.options.StrataOptions;
import picocli.CommandLine;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Resolves options against configuration, connects and plans; subclasses decide what to do
 * with the plan.
 */
public abstract class AbstractDbCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(AbstractDbCommand.class);

    @CommandLine.Mixin
    protected DatabaseOptions options;

    protected Map<String, String> config = Map.of();

    @Override
    public Integer call() {
        try {
            config = new ConfigurationLoader().loadConfiguration(options.getProfile());

            SchemaIoService io = new SchemaIoService(schemaDir(), outputDir());
            List<TableFragment> fragments = io.loadFragments();

            try (Connection connection = new DatabaseConnector().open(url(), user(), password())) {
                MigrationService service = new MigrationService(new DefaultNaming(maxLength()));
                MigrationResult result = service.plan(connection, fragments, databaseType());
                return handle(result, io);
            }
        } catch (Exception e) {
            log.debug("Command failed", e);
            System.err.println(failurePrefix() + e.getMessage());
            return 1;
        }
    }

    protected abstract Integer handle(MigrationResult result, SchemaIoService io) throws Exception;

    protected abstract String failurePrefix();

    protected void printPlan(MigrationResult result) {
        System.out.println("Migration plan (" + result.getDatabaseType().name().toLowerCase(Locale.ROOT) + "):");
        result.getToBeAdded().forEach(t ->
                System.out.println("  + Table " + t.table() + ": Add fields [" + String.join(", ", t.fields()) + "]"));
        result.getToBeCreated().forEach(t ->
                System.out.println("  + Create table " + t));
        if (!result.getDiff().getTypeMismatches().isEmpty()) {
            System.out.println("Type mismatches (not changed):");
            result.getDiff().getTypeMismatches().forEach(m ->
                    System.out.println("  ! " + m.getTable() + "." + m.getColumn()
                            + ": expected " + m.getExpected().wireName() + ", found " + m.getActual()));
        }
    }

    // CLI option > strata.yaml > default

    private String url() {
        String url = firstNonBlank(options.getUrl(), config.get(StrataOptions.Database.URL_KEY));
        if (url == null) {
            throw new IllegalArgumentException("No database URL configured; use --url or database.url in "
                    + StrataOptions.Profile.CONFIG_FILE);
        }
        return url;
    }

    private String user() {
        return firstNonBlank(options.getUser(), config.get(StrataOptions.Database.USERNAME_KEY));
    }

    private String password() {
        return firstNonBlank(options.getPassword(), config.get(StrataOptions.Database.PASSWORD_KEY));
    }

    private DatabaseType databaseType() {
        String name = firstNonBlank(options.getDialect(), config.get(StrataOptions.Database.DIALECT_KEY));
        return name == null ? null : DatabaseType.fromName(name);
    }

    private Path schemaDir() {
        if (options.getSchemaDir() != null) return options.getSchemaDir();
        return Paths.get(config.getOrDefault(StrataOptions.Schema.DIRECTORY_KEY, StrataOptions.Schema.DIRECTORY_DEFAULT));
    }

    private Path outputDir() {
        if (options.getOutputDir() != null) return options.getOutputDir();
        return Paths.get(config.getOrDefault(StrataOptions.Output.DIRECTORY_KEY, StrataOptions.Output.DIRECTORY_DEFAULT));
    }

    private int maxLength() {
        if (options.getMaxLength() != null) return options.getMaxLength();
        String configured = config.get(StrataOptions.Naming.MAX_LENGTH_KEY);
        if (configured != null) {
            try {
                return Integer.parseInt(configured);
            } catch (NumberFormatException e) {
                log.warn("Invalid naming.maxLength in configuration: {}. Using default: {}",
                        configured, StrataOptions.Naming.MAX_LENGTH_DEFAULT);
            }
        }
        return StrataOptions.Naming.MAX_LENGTH_DEFAULT;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        if (b != null && !b.isBlank()) return b;
        return null;
    }
}
