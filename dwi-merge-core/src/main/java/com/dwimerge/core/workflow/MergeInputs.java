package com.dwimerge.core.workflow;

import com.dwimerge.core.model.AcquisitionGroupSet;
import com.dwimerge.core.model.ConfoundTable;
import com.dwimerge.core.model.DwiImage;
import com.dwimerge.core.model.QcMetrics;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Lazily resolved inputs of a merge run.
 *
 * <p>Suppliers run inside workflow nodes, so nothing is read before the configuration and
 * the graph have been validated. Optional inputs are {@code null}.
 *
 * @param groupIds configured group ids in merge order
 * @param groups loads and validates the acquisition groups
 * @param anatomicalMask anatomical brain mask, optional
 * @param dwiMask DWI brain mask on the output grid, optional
 * @param rawQc pre-merge QC metrics, optional (computed from the raw inputs when absent)
 * @param confounds per-volume confounds of the merged series, optional
 * @param groupSourceFiles group id to original image path, for the sampling-scheme report
 * @param passThrough output name to artifact copied verbatim into the derivatives
 */
public record MergeInputs(
    List<String> groupIds,
    Supplier<AcquisitionGroupSet> groups,
    Supplier<DwiImage> anatomicalMask,
    Supplier<DwiImage> dwiMask,
    Supplier<QcMetrics> rawQc,
    Supplier<ConfoundTable> confounds,
    Map<String, String> groupSourceFiles,
    Map<String, Path> passThrough
) {
    /**
     * Compact constructor with validation.
     */
    public MergeInputs {
        Objects.requireNonNull(groupIds, "groupIds must not be null");
        Objects.requireNonNull(groups, "groups must not be null");
        groupIds = List.copyOf(groupIds);
        groupSourceFiles = groupSourceFiles == null ? Map.of() : new LinkedHashMap<>(groupSourceFiles);
        passThrough = passThrough == null ? Map.of() : new LinkedHashMap<>(passThrough);
    }

    /**
     * Inputs holding already loaded groups, with no QC files or pass-through artifacts.
     *
     * @param groups loaded groups
     * @param anatomicalMask anatomical mask, may be {@code null}
     * @param dwiMask DWI mask, may be {@code null}
     * @return inputs
     */
    public static MergeInputs of(AcquisitionGroupSet groups, DwiImage anatomicalMask, DwiImage dwiMask) {
        return new MergeInputs(groups.ids(), () -> groups,
            anatomicalMask == null ? null : () -> anatomicalMask,
            dwiMask == null ? null : () -> dwiMask,
            null, null, Map.of(), Map.of());
    }
}
