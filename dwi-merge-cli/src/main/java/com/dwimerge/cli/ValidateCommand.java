package com.dwimerge.cli;

import com.dwimerge.core.config.ConfigLoader;
import com.dwimerge.core.config.MergeConfig;
import com.dwimerge.core.config.MergeConfigValidator;
import com.dwimerge.core.config.MergeSettings;
import com.dwimerge.core.denoise.MrtrixDenoiser;
import com.dwimerge.core.io.ArtifactLoader;
import com.dwimerge.core.model.AcquisitionGroupSet;
import com.dwimerge.core.workflow.DistortionGroupMergeWorkflow;
import com.dwimerge.core.workflow.WorkflowGraph;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate configuration, inputs and the workflow graph without merging.
 */
@Command(
    name = "validate",
    description = "Validate configuration, group inputs and workflow graph",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Option(names = {"--config-only"}, description = "Skip loading the group inputs")
    private boolean configOnly;

    @Override
    public Integer call() {
        try {
            log.info("Validating configuration: {}", configFile);
            Path parent = configFile.toAbsolutePath().getParent();
            Path baseDirectory = parent != null ? parent : Path.of(".").toAbsolutePath();

            MergeConfig config = ConfigLoader.load(configFile);
            MergeSettings settings = MergeConfigValidator.validate(config, baseDirectory);
            System.out.println("✓ Configuration valid");
            System.out.println("  Strategy: " + settings.strategy().id());
            System.out.println("  b0 threshold: " + settings.mergeContext().b0Threshold());
            System.out.println("  Denoise window: " + settings.denoise().window()
                + (settings.denoise().beforeMerge() ? " (per group, before merging)" : ""));

            DistortionGroupMergeWorkflow workflow =
                DistortionGroupMergeWorkflow.fromConfig(config, baseDirectory, new MrtrixDenoiser(), null);
            WorkflowGraph graph = workflow.graph();
            graph.validate();
            System.out.println("✓ Workflow graph valid (" + graph.size() + " nodes)");

            if (!configOnly) {
                AcquisitionGroupSet groups = new ArtifactLoader(baseDirectory).load(config.groupsOrEmpty());
                System.out.println("✓ Inputs valid: " + groups.size() + " groups, "
                    + groups.totalVolumeCount() + " volumes");
            }
            return ExitCodes.OK;
        } catch (Exception e) {
            return ExitCodes.report("Validation", e, log);
        }
    }
}
