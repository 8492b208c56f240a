package com.dwimerge.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void call_validSession_checksConfigGraphAndInputs() throws Exception {
        Path config = CliSession.write(tempDir, "concat", true);

        int exitCode = new CommandLine(new ValidateCommand()).execute(config.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("✓ Configuration valid")
            .contains("Strategy: concat")
            .contains("✓ Workflow graph valid")
            .contains("✓ Inputs valid: 2 groups, 8 volumes");
    }

    @Test
    void call_configOnly_skipsInputs() throws Exception {
        Path config = Files.writeString(tempDir.resolve("dwimerge.yaml"), """
            qc:
              anatomicalMask: missing_anat.nii.gz
              dwiMask: missing_dwi.nii.gz
            groups:
              - id: dir-AP
                image: absent.nii.gz
            """);

        int exitCode = new CommandLine(new ValidateCommand()).execute(config.toString(), "--config-only");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString(StandardCharsets.UTF_8)).doesNotContain("Inputs valid");
    }

    @Test
    void call_contradictoryDenoiseSettings_returnsConfigError() throws Exception {
        Path config = Files.writeString(tempDir.resolve("dwimerge.yaml"), """
            combineAllDwis: false
            denoise:
              window: 7
              beforeCombining: true
            groups:
              - id: dir-AP
            """);

        int exitCode = new CommandLine(new ValidateCommand()).execute(config.toString(), "--config-only");

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIG_ERROR);
    }

    @Test
    void call_missingMasks_returnsFailure() throws Exception {
        Path config = CliSession.write(tempDir, "average", false);

        int exitCode = new CommandLine(new ValidateCommand()).execute(config.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.FAILURE);
    }
}
