package org.strata.cli;

import lombok.Getter;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Connection and location options shared by the db subcommands. Every option left unset falls
 * back to {@code strata.yaml}.
 */
@Getter
public class DatabaseOptions {

    @CommandLine.Option(names = "--url", description = "JDBC URL of the target database")
    private String url;

    @CommandLine.Option(names = {"-u", "--user"}, description = "Database user")
    private String user;

    @CommandLine.Option(names = "--password", description = "Database password")
    private String password;

    @CommandLine.Option(names = {"-d", "--dialect"},
            description = "postgres, mysql, sqlite or mssql; detected from the connection when absent")
    private String dialect;

    @CommandLine.Option(names = {"-s", "--schema"}, description = "Directory with JSON/YAML schema files")
    private Path schemaDir;

    @CommandLine.Option(names = "--out", description = "Directory the generated migration SQL is written to")
    private Path outputDir;

    @CommandLine.Option(names = "--max-length", description = "Maximum length of generated index/constraint names")
    private Integer maxLength;

    @CommandLine.Option(names = "--profile", description = "Configuration profile (dev, prod, test ...)")
    private String profile;
}
