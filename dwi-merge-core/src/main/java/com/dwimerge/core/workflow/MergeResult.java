package com.dwimerge.core.workflow;

import com.dwimerge.core.model.DwiImage;
import com.dwimerge.core.model.GradientTable;
import com.dwimerge.core.model.MergedDataset;
import com.dwimerge.core.model.SeriesQcRecord;

import java.nio.file.Path;
import java.util.Map;

/**
 * Outputs of a successful merge run.
 *
 * @param dataset merged (and, if configured, denoised) dataset
 * @param gradientTable gradient table of the dataset
 * @param seriesQc series QC record
 * @param noiseMaps noise maps keyed by group id, or {@code merged}
 * @param samplingSchemeReport written reportlet
 * @param derivatives written derivatives by output name, empty without a sink
 * @param run the underlying workflow run
 */
public record MergeResult(
    MergedDataset dataset,
    GradientTable gradientTable,
    SeriesQcRecord seriesQc,
    Map<String, DwiImage> noiseMaps,
    Path samplingSchemeReport,
    Map<String, Path> derivatives,
    WorkflowRun run
) {}
