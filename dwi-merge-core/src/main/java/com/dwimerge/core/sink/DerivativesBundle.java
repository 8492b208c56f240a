package com.dwimerge.core.sink;

import com.dwimerge.core.model.DwiImage;
import com.dwimerge.core.model.GradientTable;
import com.dwimerge.core.model.MergedDataset;
import com.dwimerge.core.model.SeriesQcRecord;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a merge run hands to a {@link DerivativesSink}.
 *
 * @param prefix output prefix
 * @param sourceFile identifier the derivatives are keyed by, may be {@code null}
 * @param dataset merged dataset ({@code merged_image}, {@code merged_bval}, {@code merged_bvec})
 * @param gradientTable {@code gradient_table_t1}
 * @param seriesQc {@code merged_qc}
 * @param noiseMaps noise maps keyed by group id, or {@code merged}
 * @param passThrough artifacts copied verbatim, keyed by output name
 */
public record DerivativesBundle(
    String prefix,
    String sourceFile,
    MergedDataset dataset,
    GradientTable gradientTable,
    SeriesQcRecord seriesQc,
    Map<String, DwiImage> noiseMaps,
    Map<String, Path> passThrough
) {
    /**
     * Compact constructor with validation.
     */
    public DerivativesBundle {
        Objects.requireNonNull(prefix, "prefix must not be null");
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(gradientTable, "gradientTable must not be null");
        Objects.requireNonNull(seriesQc, "seriesQc must not be null");
        noiseMaps = noiseMaps == null ? Map.of() : new LinkedHashMap<>(noiseMaps);
        passThrough = passThrough == null ? Map.of() : new LinkedHashMap<>(passThrough);
    }
}
