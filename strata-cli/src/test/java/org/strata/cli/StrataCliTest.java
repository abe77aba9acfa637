package org.strata.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class StrataCliTest {

    private final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    private final Level originalLevel = root.getLevel();

    @AfterEach
    void restoreLevel() {
        root.setLevel(originalLevel);
    }

    @Test
    @DisplayName("Without a subcommand the usage is printed")
    void printsUsage() {
        try (StreamCaptor io = new StreamCaptor()) {
            int exitCode = StrataCli.commandLine().execute();

            assertThat(exitCode).isZero();
            assertThat(io.out()).contains("Usage: strata").contains("db");
        }
    }

    @Test
    @DisplayName("--version prints the version")
    void printsVersion() {
        StringWriter out = new StringWriter();
        int exitCode = StrataCli.commandLine().setOut(new PrintWriter(out)).execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("strata 0.1.0");
    }

    @Test
    @DisplayName("db --help lists plan and migrate")
    void dbHelp() {
        StringWriter out = new StringWriter();
        int exitCode = StrataCli.commandLine().setOut(new PrintWriter(out)).execute("db", "--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("plan").contains("migrate");
    }

    @Test
    @DisplayName("-q sets the root level to ERROR and -v to DEBUG")
    void loggingFlags() {
        try (StreamCaptor ignored = new StreamCaptor()) {
            StrataCli.commandLine().execute("-q");
            assertThat(root.getLevel()).isEqualTo(Level.ERROR);

            StrataCli.commandLine().execute("-v");
            assertThat(root.getLevel()).isEqualTo(Level.DEBUG);

            StrataCli.commandLine().execute();
            assertThat(root.getLevel()).isEqualTo(Level.INFO);
        }
    }

    @Test
    @DisplayName("Unknown options fail with a usage error")
    void unknownOption() {
        StringWriter err = new StringWriter();
        int exitCode = StrataCli.commandLine().setErr(new PrintWriter(err)).execute("--bogus");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--bogus");
    }
}
