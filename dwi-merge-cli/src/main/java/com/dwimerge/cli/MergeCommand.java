package com.dwimerge.cli;

import com.dwimerge.core.config.ConfigLoader;
import com.dwimerge.core.config.MergeConfig;
import com.dwimerge.core.denoise.MrtrixDenoiser;
import com.dwimerge.core.io.NiftiImageStore;
import com.dwimerge.core.model.MergedDataset;
import com.dwimerge.core.model.SeriesQcRecord;
import com.dwimerge.core.sink.FileSystemDerivativesSink;
import com.dwimerge.core.workflow.DistortionGroupMergeWorkflow;
import com.dwimerge.core.workflow.MergeResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to run the merge workflow.
 *
 * <p>Loads the configuration, validates it, builds the workflow graph and runs it.
 * Outputs go to the configured derivatives directory unless {@code --dry-run} is given.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Merge with dwimerge.yaml from the current directory
 * dwimerge merge
 *
 * # Override strategy and output directory
 * dwimerge merge session/dwimerge.yaml --strategy concat -o /tmp/derivatives
 * }</pre>
 */
@Command(
    name = "merge",
    description = "Merge the distortion groups described by a configuration file",
    mixinStandardHelpOptions = true
)
public class MergeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MergeCommand.class);

    @Parameters(
        index = "0",
        description = "Configuration file (default: dwimerge.yaml)",
        defaultValue = ConfigLoader.DEFAULT_FILE_NAME
    )
    private Path configFile;

    @Option(names = {"-s", "--strategy"}, description = "Merge strategy: average or concat (overrides config)")
    private String strategy;

    @Option(names = {"-o", "--output"}, description = "Derivatives directory (overrides config)")
    private Path outputDir;

    @Option(names = {"-t", "--threads"}, description = "Worker threads (overrides config)")
    private Integer threads;

    @Option(names = {"--dwidenoise"}, description = "dwidenoise executable (default: dwidenoise on PATH)",
        defaultValue = "dwidenoise")
    private String dwidenoise;

    @Option(names = {"--dry-run"}, description = "Run the merge but write no derivatives")
    private boolean dryRun;

    @Override
    public Integer call() {
        try {
            Path baseDirectory = baseDirectory();
            MergeConfig config = ConfigLoader.load(configFile)
                .withOverrides(strategy, outputDir == null ? null : outputDir.toAbsolutePath().toString(), threads);

            System.out.println("Merging distortion groups from: " + configFile.toAbsolutePath());
            DistortionGroupMergeWorkflow workflow = DistortionGroupMergeWorkflow.fromConfig(
                config,
                baseDirectory,
                new MrtrixDenoiser(dwidenoise, new NiftiImageStore()),
                dryRun ? null : new FileSystemDerivativesSink(outputDirectory(config, baseDirectory)));
            System.out.println("✓ Configuration valid (strategy: " + workflow.settings().strategy().id() + ")");

            MergeResult result = workflow.run();
            printSummary(result);
            return ExitCodes.OK;
        } catch (Exception e) {
            return ExitCodes.report("Merge", e, log);
        }
    }

    private Path baseDirectory() {
        Path parent = configFile.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".").toAbsolutePath();
    }

    private static Path outputDirectory(MergeConfig config, Path baseDirectory) {
        return baseDirectory.resolve(config.outputOrDefaults().directoryOrDefault()).normalize();
    }

    private void printSummary(MergeResult result) {
        MergedDataset dataset = result.dataset();
        SeriesQcRecord qc = result.seriesQc();
        System.out.println("✓ Merged " + dataset.groupOrder().size() + " groups into "
            + dataset.volumeCount() + " volumes (" + dataset.averagedVolumeCount() + " averaged)");
        System.out.println("✓ Shells: " + qc.shells());
        System.out.printf("✓ Mask overlap (Dice): %.3f%n", qc.diceScore());
        if (!result.noiseMaps().isEmpty()) {
            System.out.println("✓ Noise maps: " + result.noiseMaps().keySet());
        }
        System.out.println("✓ Sampling scheme report: " + result.samplingSchemeReport());
        if (dryRun) {
            System.out.println("Dry-run mode: no derivatives written");
        } else {
            result.derivatives().forEach((name, path) -> System.out.println("  " + name + ": " + path));
        }
        System.out.println();
        System.out.println("✓ Merge complete");
    }
}
