package com.dwimerge.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The single quality-control record of a merged series.
 *
 * <p>{@link #toRow()} flattens the record into the column order of the series QC file:
 * file name, pre-merge ({@code raw_}) metrics, post-merge ({@code t1_}) metrics, confound
 * summary, mask overlap and the gradient scheme of the merged series.
 *
 * @param fileName output prefix identifying the series
 * @param sourceFile source file the derivatives are keyed by, may be {@code null}
 * @param diceScore Dice overlap of anatomical and resampled DWI masks
 * @param preMerge pre-merge metrics, already prefixed with {@code raw_}
 * @param postMerge post-merge metrics, already prefixed with {@code t1_}
 * @param confounds motion summary
 * @param mergedVolumes volume count of the merged series
 * @param shells distinct b-value shells of the merged series
 * @param strategyId merge strategy that produced the series
 */
public record SeriesQcRecord(
    String fileName,
    String sourceFile,
    double diceScore,
    QcMetrics preMerge,
    QcMetrics postMerge,
    ConfoundSummary confounds,
    int mergedVolumes,
    List<Double> shells,
    String strategyId
) {
    /**
     * Compact constructor with validation.
     */
    public SeriesQcRecord {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(preMerge, "preMerge must not be null");
        Objects.requireNonNull(postMerge, "postMerge must not be null");
        Objects.requireNonNull(confounds, "confounds must not be null");
        Objects.requireNonNull(strategyId, "strategyId must not be null");
        shells = shells == null ? List.of() : List.copyOf(shells);
    }

    /**
     * Flattens the record into ordered columns.
     *
     * @return column name to value
     */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("file_name", fileName);
        row.putAll(preMerge.values());
        row.putAll(postMerge.values());
        row.put("mean_fd", confounds.meanFramewiseDisplacement());
        row.put("max_fd", confounds.maxFramewiseDisplacement());
        row.put("max_rotation", confounds.maxRotation());
        row.put("max_translation", confounds.maxTranslation());
        row.put("max_rel_rotation", confounds.maxRelativeRotation());
        row.put("max_rel_translation", confounds.maxRelativeTranslation());
        row.put("t1_dice_distance", diceScore);
        row.put("merged_num_volumes", mergedVolumes);
        row.put("merged_shells", shells.stream().map(s -> String.valueOf(s.longValue())).reduce((a, b) -> a + " " + b).orElse(""));
        row.put("merging_strategy", strategyId);
        return row;
    }
}
