package com.dwimerge;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DwiMergeCLI}.
 */
class DwiMergeCLITest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restore() {
        System.setOut(originalOut);
        root().setLevel(Level.INFO);
    }

    private static ch.qos.logback.classic.Logger root() {
        return (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    @Test
    void execute_verboseSubcommand_setsDebugLevelBeforeRunning() {
        int exitCode = DwiMergeCLI.commandLine().execute("-v", "list");

        assertThat(exitCode).isZero();
        assertThat(root().getLevel()).isEqualTo(Level.DEBUG);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("(ID: average)");
    }

    @Test
    void execute_quiet_setsErrorLevel() {
        int exitCode = DwiMergeCLI.commandLine().execute("-q");

        assertThat(exitCode).isZero();
        assertThat(root().getLevel()).isEqualTo(Level.ERROR);
        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void execute_noCommand_printsUsageHint() {
        int exitCode = DwiMergeCLI.commandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("dwimerge --help");
    }

    @Test
    void execute_version_printsVersion() {
        int exitCode = DwiMergeCLI.commandLine().execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("dwi-merge 1.0.0-SNAPSHOT");
    }
}
