package com.umlarchitect;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link UmlArchitectCLI}.
 */
class UmlArchitectCLITest {

    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream out;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        rootLogger().setLevel(Level.INFO);
    }

    @Test
    void run_withoutSubcommand_printsBanner() {
        int exitCode = new UmlArchitectCLI().createCommandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("UML Architect");
    }

    @Test
    void run_quiet_printsNothingAndRaisesLogLevel() {
        UmlArchitectCLI cli = new UmlArchitectCLI();

        int exitCode = cli.createCommandLine().execute("-q");

        assertThat(exitCode).isZero();
        assertThat(cli.isQuiet()).isTrue();
        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
        assertThat(rootLogger().getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void verbose_beforeSubcommand_enablesDebugLogging() {
        UmlArchitectCLI cli = new UmlArchitectCLI();

        int exitCode = cli.createCommandLine().execute("-v", "list", "generators");

        assertThat(exitCode).isZero();
        assertThat(cli.isVerbose()).isTrue();
        assertThat(rootLogger().getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void version_printsVersion() {
        int exitCode = new UmlArchitectCLI().createCommandLine().execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("1.0.0-SNAPSHOT");
    }

    private static ch.qos.logback.classic.Logger rootLogger() {
        return (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    }
}
