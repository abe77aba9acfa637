package org.strata.cli;

import org.strata.cli.service.SchemaIoService;
import org.strata.migration.MigrationResult;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Shows what a migration would do and writes its SQL without touching the database.
 */
@CommandLine.Command(
        name = "plan",
        mixinStandardHelpOptions = true,
        description = "Compares the schema with the database and writes the migration SQL."
)
public class PlanCommand extends AbstractDbCommand {

    @Override
    protected Integer handle(MigrationResult result, SchemaIoService io) throws Exception {
        if (result.isUpToDate()) {
            System.out.println("Database is up to date");
            return 0;
        }
        printPlan(result);
        Path file = io.writeMigration(result);
        System.out.println("Migration SQL written to " + file);
        return 0;
    }

    @Override
    protected String failurePrefix() {
        return "Planning failed: ";
    }
}
