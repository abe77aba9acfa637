package org.strata.cli;

import org.strata.cli.service.SchemaIoService;
import org.strata.migration.MigrationResult;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Applies the planned migration after confirmation.
 */
@CommandLine.Command(
        name = "migrate",
        mixinStandardHelpOptions = true,
        description = "Creates missing tables and columns in the database."
)
public class MigrateCommand extends AbstractDbCommand {

    @CommandLine.Option(names = {"-y", "--yes"}, description = "Apply without asking for confirmation")
    private boolean yes;

    @Override
    protected Integer handle(MigrationResult result, SchemaIoService io) throws Exception {
        if (result.isUpToDate()) {
            System.out.println("Database is up to date");
            return 0;
        }
        printPlan(result);

        if (!yes && !confirm()) {
            System.out.println("Migration cancelled");
            return 0;
        }
        result.run();
        System.out.println("Migration completed");
        return 0;
    }

    @Override
    protected String failurePrefix() {
        return "Migration failed: ";
    }

    private boolean confirm() throws IOException {
        System.out.print("Apply these changes? [y/N] ");
        System.out.flush();
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String answer = in.readLine();
        if (answer == null) return false;
        String a = answer.trim().toLowerCase(Locale.ROOT);
        return a.equals("y") || a.equals("yes");
    }
}
