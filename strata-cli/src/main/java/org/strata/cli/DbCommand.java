package org.strata.cli;

import picocli.CommandLine;

@CommandLine.Command(
        name = "db",
        description = "Database schema commands",
        mixinStandardHelpOptions = true,
        subcommands = {
                PlanCommand.class,
                MigrateCommand.class
        }
)
public class DbCommand {

}
