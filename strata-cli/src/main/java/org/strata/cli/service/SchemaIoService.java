package org.strata.cli.service;

import org.strata.migration.MigrationResult;
import org.strata.migration.output.SqlMigrationHandler;
import org.strata.model.TableFragment;
import org.strata.schema.SchemaFragmentReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads schema fragments from the schema directory and writes migration SQL to the output
 * directory.
 */
public class SchemaIoService {

    private final SchemaFragmentReader reader = new SchemaFragmentReader();
    private final SqlMigrationHandler sqlHandler;

    private final Path schemaDir;
    private final Path outputDir;

    /**
     * @param schemaDir directory containing JSON/YAML schema files
     * @param outputDir directory for generated SQL
     */
    public SchemaIoService(Path schemaDir, Path outputDir) {
        this(schemaDir, outputDir, new SqlMigrationHandler());
    }

    public SchemaIoService(Path schemaDir, Path outputDir, SqlMigrationHandler sqlHandler) {
        this.schemaDir = schemaDir;
        this.outputDir = outputDir;
        this.sqlHandler = sqlHandler;
    }

    /**
     * @throws IOException when the schema directory is missing or a file cannot be parsed
     */
    public List<TableFragment> loadFragments() throws IOException {
        return reader.readDirectory(schemaDir);
    }

    /**
     * @return the written SQL file
     */
    public Path writeMigration(MigrationResult result) throws IOException {
        return sqlHandler.handle(result, outputDir);
    }
}
