package org.strata.migration.output;

import org.strata.migration.MigrationResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Writes a compiled plan to {@code migration-<yyyyMMddHHmmss>.sql} in the output directory.
 */
public class SqlMigrationHandler {
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Clock clock;

    public SqlMigrationHandler() {
        this(Clock.systemDefaultZone());
    }

    public SqlMigrationHandler(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the written file
     */
    public Path handle(MigrationResult result, Path outputDir) throws IOException {
        LocalDateTime now = LocalDateTime.now(clock);
        String sql = generateHeader(result, now) + "\n" + result.compile() + "\n";

        Files.createDirectories(outputDir);
        Path file = outputDir.resolve("migration-" + now.format(FILE_STAMP) + ".sql");
        Files.writeString(file, sql);
        return file;
    }

    private String generateHeader(MigrationResult result, LocalDateTime now) {
        return String.format("""
                -- Strata Migration
                -- strata:dialect=%s
                -- strata:generated=%s
                """,
                result.getDatabaseType().name().toLowerCase(Locale.ROOT),
                now.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
    }
}
