package com.dwimerge.core.workflow;

import com.dwimerge.core.config.MergeConfig;
import com.dwimerge.core.config.MergeConfigValidator;
import com.dwimerge.core.config.MergeSettings;
import com.dwimerge.core.denoise.DenoiseResult;
import com.dwimerge.core.denoise.DenoiseStage;
import com.dwimerge.core.denoise.Denoiser;
import com.dwimerge.core.error.ValidationException;
import com.dwimerge.core.gradient.GradientTableBuilder;
import com.dwimerge.core.gradient.SamplingSchemeReport;
import com.dwimerge.core.io.ArtifactLoader;
import com.dwimerge.core.io.NiftiImageStore;
import com.dwimerge.core.io.TabularFiles;
import com.dwimerge.core.merge.MergeStrategies;
import com.dwimerge.core.merge.MergeStrategy;
import com.dwimerge.core.model.AcquisitionGroup;
import com.dwimerge.core.model.AcquisitionGroupSet;
import com.dwimerge.core.model.ConfoundTable;
import com.dwimerge.core.model.DwiImage;
import com.dwimerge.core.model.GradientTable;
import com.dwimerge.core.model.MergedDataset;
import com.dwimerge.core.model.QcMetrics;
import com.dwimerge.core.model.SeriesQcRecord;
import com.dwimerge.core.model.Vector3;
import com.dwimerge.core.qc.ImageQcCalculator;
import com.dwimerge.core.qc.MaskOverlap;
import com.dwimerge.core.qc.SeriesQcAggregator;
import com.dwimerge.core.sink.DerivativesBundle;
import com.dwimerge.core.sink.DerivativesSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds and runs the dependency graph that merges the distortion groups of one DWI session.
 *
 * <p>Nodes (ids as used in logs and {@link WorkflowRun}):
 * <pre>
 * collect_groups ─┬─ denoise_&lt;group&gt; (per group, before merging) ─┐
 *                 └──────────────────────────────────────────────┴─ distortion_merger
 * distortion_merger ─ denoise_merged (after merging) ─ merged_dataset
 * merged_dataset ─┬─ gtab_t1 ─┬─ gradient_plot
 *                 │           └─ series_qc ─ ds_outputs
 *                 └─ merged_qc ─ series_qc
 * distortion_merger ─ raw_qc ─ series_qc
 * t1_dice_calc, confounds ─ series_qc
 * </pre>
 *
 * <p>The configuration is validated when the workflow is created, and the graph when it is
 * run, so a contradictory configuration or a missing QC input fails before any image is read.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DistortionGroupMergeWorkflow workflow = DistortionGroupMergeWorkflow.fromConfig(
 *     config, configDirectory, new MrtrixDenoiser(), new FileSystemDerivativesSink(outputDir));
 * MergeResult result = workflow.run();
 * }</pre>
 */
public class DistortionGroupMergeWorkflow {

    private static final Logger log = LoggerFactory.getLogger(DistortionGroupMergeWorkflow.class);

    public static final String COLLECT_GROUPS = "collect_groups";
    public static final String MERGE = "distortion_merger";
    public static final String DENOISE_MERGED = "denoise_merged";
    public static final String MERGED_DATASET = "merged_dataset";
    public static final String GRADIENT_TABLE = "gtab_t1";
    public static final String SAMPLING_SCHEME = "gradient_plot";
    public static final String MASK_OVERLAP = "t1_dice_calc";
    public static final String RAW_QC = "raw_qc";
    public static final String MERGED_QC = "merged_qc";
    public static final String CONFOUNDS = "confounds";
    public static final String SERIES_QC = "series_qc";
    public static final String DERIVATIVES = "ds_outputs";

    private final MergeSettings settings;
    private final MergeInputs inputs;
    private final MergeStrategy strategy;
    private final DenoiseStage denoiseStage;
    private final DerivativesSink sink;
    private final ImageQcCalculator qcCalculator;
    private final GradientTableBuilder gradientTableBuilder;
    private final SamplingSchemeReport samplingSchemeReport;

    /**
     * Creates the workflow.
     *
     * @param settings validated settings
     * @param inputs lazily resolved inputs
     * @param denoiser denoiser used when the denoise window is positive
     * @param sink derivatives sink, or {@code null} to keep outputs in memory only
     */
    public DistortionGroupMergeWorkflow(MergeSettings settings, MergeInputs inputs, Denoiser denoiser, DerivativesSink sink) {
        this.settings = settings;
        this.inputs = inputs;
        this.strategy = MergeStrategies.forType(settings.strategy());
        this.denoiseStage = new DenoiseStage(settings.denoise(), denoiser);
        this.sink = sink;
        this.qcCalculator = new ImageQcCalculator(settings.mergeContext().b0Threshold());
        this.gradientTableBuilder = new GradientTableBuilder(settings.mergeContext().b0Threshold(), true);
        this.samplingSchemeReport = new SamplingSchemeReport(settings.reportletsDirectory());
    }

    /**
     * Validates a loaded configuration and wires file-backed inputs.
     *
     * @param config loaded configuration
     * @param baseDirectory directory relative paths resolve against
     * @param denoiser denoiser used when the denoise window is positive
     * @param sink derivatives sink, or {@code null}
     * @return workflow ready to run
     * @throws com.dwimerge.core.error.ConfigException if the configuration is invalid
     */
    public static DistortionGroupMergeWorkflow fromConfig(MergeConfig config, Path baseDirectory,
                                                          Denoiser denoiser, DerivativesSink sink) {
        MergeSettings settings = MergeConfigValidator.validate(config, baseDirectory);
        ArtifactLoader loader = new ArtifactLoader(baseDirectory);
        NiftiImageStore images = new NiftiImageStore();
        TabularFiles tables = new TabularFiles();
        MergeConfig.QcConfig qc = config.qcOrDefaults();

        List<String> groupIds = new ArrayList<>();
        Map<String, String> sourceFiles = new LinkedHashMap<>();
        for (MergeConfig.GroupConfig group : config.groupsOrEmpty()) {
            groupIds.add(group.id());
            if (group.originalImage() != null) {
                sourceFiles.put(AcquisitionGroupSet.sanitize(group.id()), group.originalImage());
            }
        }
        Map<String, Path> passThrough = new LinkedHashMap<>();
        config.passThroughOrEmpty().forEach((name, path) -> passThrough.put(name, loader.resolve(path)));

        MergeInputs inputs = new MergeInputs(
            groupIds,
            () -> loader.load(config.groupsOrEmpty()),
            qc.anatomicalMask() == null ? null : () -> images.read(loader.resolve(qc.anatomicalMask())),
            qc.dwiMask() == null ? null : () -> images.read(loader.resolve(qc.dwiMask())),
            qc.rawQcFile() == null ? null : () -> tables.readQcMetrics(loader.resolve(qc.rawQcFile())),
            qc.confounds() == null ? null : () -> tables.readConfounds(loader.resolve(qc.confounds())),
            sourceFiles,
            passThrough);
        return new DistortionGroupMergeWorkflow(settings, inputs, denoiser, sink);
    }

    public MergeSettings settings() {
        return settings;
    }

    public static String denoiseNodeId(String groupId) {
        return "denoise_" + AcquisitionGroupSet.sanitize(groupId);
    }

    /**
     * Builds the dependency graph. Nothing runs until the graph is handed to a runner.
     *
     * @return unvalidated graph
     */
    public WorkflowGraph graph() {
        WorkflowGraph.Builder graph = WorkflowGraph.builder();
        graph.node(COLLECT_GROUPS, List.of(), false, in -> collectGroups());

        List<String> mergeDependencies = new ArrayList<>();
        mergeDependencies.add(COLLECT_GROUPS);
        if (denoiseStage.runsBeforeMerge()) {
            for (String groupId : inputs.groupIds()) {
                String sanitized = AcquisitionGroupSet.sanitize(groupId);
                String nodeId = denoiseNodeId(groupId);
                graph.node(nodeId, List.of(COLLECT_GROUPS), false,
                    in -> denoiseStage.denoiseGroup(findGroup(in.get(COLLECT_GROUPS, AcquisitionGroupSet.class), sanitized)));
                mergeDependencies.add(nodeId);
            }
        }
        graph.node(MERGE, mergeDependencies, false, this::merge);

        List<String> datasetDependencies = new ArrayList<>(List.of(MERGE));
        if (denoiseStage.runsAfterMerge()) {
            graph.node(DENOISE_MERGED, List.of(MERGE), false,
                in -> denoiseStage.denoiseMerged(in.get(MERGE, MergedDataset.class)));
            datasetDependencies.add(DENOISE_MERGED);
        }
        graph.node(MERGED_DATASET, datasetDependencies, true, in -> {
            MergedDataset merged = in.get(MERGE, MergedDataset.class);
            DenoiseResult denoised = in.find(DENOISE_MERGED, DenoiseResult.class);
            return denoised == null ? merged : merged.withImage(denoised.denoised());
        });

        graph.node(GRADIENT_TABLE, List.of(MERGED_DATASET), true,
            in -> gradientTableBuilder.build(in.get(MERGED_DATASET, MergedDataset.class)));
        graph.node(SAMPLING_SCHEME, List.of(MERGED_DATASET, GRADIENT_TABLE), true,
            in -> samplingSchemeReport.write(settings.prefix(), in.get(MERGED_DATASET, MergedDataset.class),
                in.get(GRADIENT_TABLE, GradientTable.class), inputs.groupSourceFiles()));

        if (inputs.anatomicalMask() != null && inputs.dwiMask() != null) {
            graph.node(MASK_OVERLAP, List.of(), false,
                in -> MaskOverlap.dice(inputs.anatomicalMask().get(), inputs.dwiMask().get()));
        } else {
            log.debug("No anatomical and DWI masks configured; {} is not part of the graph", MASK_OVERLAP);
        }
        graph.node(RAW_QC, List.of(COLLECT_GROUPS, MERGE), false, this::rawQc);
        graph.node(MERGED_QC, List.of(MERGED_DATASET), false, in -> {
            MergedDataset dataset = in.get(MERGED_DATASET, MergedDataset.class);
            return qcCalculator.compute(dataset.image(), dataset.bvals(), dataset.bvecs());
        });
        graph.node(CONFOUNDS, List.of(COLLECT_GROUPS), true, this::confounds);

        graph.node(SERIES_QC, List.of(MASK_OVERLAP, RAW_QC, MERGED_QC, GRADIENT_TABLE, CONFOUNDS), true,
            in -> new SeriesQcAggregator(settings.prefix(), strategy.getId())
                .sourceFile(settings.sourceFile())
                .diceScore(in.get(MASK_OVERLAP, Double.class))
                .preMergeMetrics(in.get(RAW_QC, QcMetrics.class))
                .postMergeMetrics(in.get(MERGED_QC, QcMetrics.class))
                .gradientTable(in.get(GRADIENT_TABLE, GradientTable.class))
                .confounds(in.find(CONFOUNDS, ConfoundTable.class))
                .aggregate());

        if (sink != null) {
            List<String> outputDependencies = new ArrayList<>(List.of(MERGED_DATASET, GRADIENT_TABLE, SERIES_QC));
            outputDependencies.addAll(noiseNodes());
            graph.node(DERIVATIVES, outputDependencies, false, in -> sink.write(new DerivativesBundle(
                settings.prefix(),
                settings.sourceFile(),
                in.get(MERGED_DATASET, MergedDataset.class),
                in.get(GRADIENT_TABLE, GradientTable.class),
                in.get(SERIES_QC, SeriesQcRecord.class),
                noiseMaps(id -> in.find(id, DenoiseResult.class)),
                inputs.passThrough())));
        }
        return graph.build();
    }

    /**
     * Builds, validates and runs the graph.
     *
     * @return outputs of the run
     * @throws com.dwimerge.core.error.DwiMergeException the first failure of the run
     */
    @SuppressWarnings("unchecked")
    public MergeResult run() {
        log.info("Merging {} distortion groups with strategy '{}'", inputs.groupIds().size(), strategy.getId());
        WorkflowRun run = new WorkflowRunner(settings.threads()).run(graph());
        run.rethrowFirstFailure();

        MergedDataset dataset = run.output(MERGED_DATASET, MergedDataset.class);
        Map<String, Path> derivatives = sink == null ? Map.of() : run.output(DERIVATIVES, Map.class);
        log.info("Merged series has {} volumes ({} averaged)", dataset.volumeCount(), dataset.averagedVolumeCount());
        return new MergeResult(
            dataset,
            run.output(GRADIENT_TABLE, GradientTable.class),
            run.output(SERIES_QC, SeriesQcRecord.class),
            noiseMaps(run.outputs()::get),
            run.output(SAMPLING_SCHEME, Path.class),
            derivatives,
            run);
    }

    private AcquisitionGroupSet collectGroups() {
        AcquisitionGroupSet groups = inputs.groups().get();
        Set<String> expected = new LinkedHashSet<>();
        inputs.groupIds().forEach(id -> expected.add(AcquisitionGroupSet.sanitize(id)));
        if (!expected.equals(new LinkedHashSet<>(groups.ids()))) {
            throw new ValidationException("groups", "Loaded groups " + groups.ids() + " differ from configured " + expected);
        }
        return groups;
    }

    private MergedDataset merge(NodeInputs in) {
        AcquisitionGroupSet groups = in.get(COLLECT_GROUPS, AcquisitionGroupSet.class);
        if (denoiseStage.runsBeforeMerge()) {
            groups = groups.map(group -> group.withImage(
                in.get(denoiseNodeId(group.id()), DenoiseResult.class).denoised()));
        }
        return strategy.merge(groups, settings.mergeContext());
    }

    private QcMetrics rawQc(NodeInputs in) {
        if (inputs.rawQc() != null) {
            return inputs.rawQc().get();
        }
        AcquisitionGroupSet groups = in.get(COLLECT_GROUPS, AcquisitionGroupSet.class);
        MergedDataset merged = in.get(MERGE, MergedDataset.class);
        List<Double> bvals = new ArrayList<>();
        List<Vector3> bvecs = new ArrayList<>();
        groups.bvals().forEach(bvals::addAll);
        groups.originalBvecs().forEach(bvecs::addAll);
        if (bvecs.size() != bvals.size()) {
            log.warn("Original b-vectors do not cover every volume; raw QC uses the corrected b-vectors");
            bvecs.clear();
            groups.bvecs().forEach(bvecs::addAll);
        }
        return qcCalculator.compute(merged.rawConcatenatedImage(), bvals, bvecs);
    }

    private ConfoundTable confounds(NodeInputs in) {
        if (inputs.confounds() != null) {
            return inputs.confounds().get();
        }
        AcquisitionGroupSet groups = in.get(COLLECT_GROUPS, AcquisitionGroupSet.class);
        if (groups.groups().stream().anyMatch(group -> group.confounds() == null)) {
            return null;
        }
        Map<String, List<Double>> columns = new LinkedHashMap<>();
        Set<String> shared = new LinkedHashSet<>(groups.get(0).confounds().columns().keySet());
        groups.groups().forEach(group -> shared.retainAll(group.confounds().columns().keySet()));
        for (String name : shared) {
            List<Double> values = new ArrayList<>();
            for (AcquisitionGroup group : groups.groups()) {
                values.addAll(group.confounds().column(name));
            }
            columns.put(name, values);
        }
        return new ConfoundTable(columns);
    }

    private List<String> noiseNodes() {
        List<String> nodes = new ArrayList<>();
        if (denoiseStage.runsBeforeMerge()) {
            inputs.groupIds().forEach(id -> nodes.add(denoiseNodeId(id)));
        } else if (denoiseStage.runsAfterMerge()) {
            nodes.add(DENOISE_MERGED);
        }
        return nodes;
    }

    private Map<String, DwiImage> noiseMaps(Function<String, Object> outputs) {
        Map<String, DwiImage> maps = new LinkedHashMap<>();
        if (denoiseStage.runsBeforeMerge()) {
            for (String groupId : inputs.groupIds()) {
                if (outputs.apply(denoiseNodeId(groupId)) instanceof DenoiseResult result) {
                    maps.put(AcquisitionGroupSet.sanitize(groupId), result.noiseMap());
                }
            }
        } else if (denoiseStage.runsAfterMerge()) {
            if (outputs.apply(DENOISE_MERGED) instanceof DenoiseResult result) {
                maps.put("merged", result.noiseMap());
            }
        }
        return maps;
    }

    private static AcquisitionGroup findGroup(AcquisitionGroupSet groups, String id) {
        return groups.groups().stream()
            .filter(group -> group.id().equals(id))
            .findFirst()
            .orElseThrow(() -> new ValidationException(id, "Group was not loaded"));
    }
}
