package com.dwimerge.core.merge;

import java.util.Objects;

/**
 * Settings handed to a {@link MergeStrategy} for one invocation.
 *
 * @param b0Threshold b-values at or below this count as b=0
 * @param harmonizeB0Intensities rescale each group so its b=0 mean matches the reference (concatenation only)
 * @param b0IntensityReference externally supplied reference b=0 mean, or {@code null} to use the first group
 * @param tolerance q-space matching tolerances (averaging only)
 */
public record MergeContext(
    double b0Threshold,
    boolean harmonizeB0Intensities,
    Double b0IntensityReference,
    QSpaceTolerance tolerance
) {
    public static final double DEFAULT_B0_THRESHOLD = 100.0;

    /**
     * Compact constructor with validation.
     */
    public MergeContext {
        if (!(b0Threshold >= 0)) {
            throw new IllegalArgumentException("b0Threshold must be >= 0");
        }
        if (b0IntensityReference != null && !(b0IntensityReference > 0)) {
            throw new IllegalArgumentException("b0IntensityReference must be positive");
        }
        if (tolerance == null) {
            tolerance = QSpaceTolerance.defaults();
        }
    }

    public static MergeContext defaults() {
        return new MergeContext(DEFAULT_B0_THRESHOLD, true, null, QSpaceTolerance.defaults());
    }

    public boolean isB0(double bValue) {
        return bValue <= b0Threshold;
    }

    public MergeContext withB0Threshold(double threshold) {
        return new MergeContext(threshold, harmonizeB0Intensities, b0IntensityReference, tolerance);
    }

    public MergeContext withHarmonization(boolean harmonize) {
        return new MergeContext(b0Threshold, harmonize, b0IntensityReference, tolerance);
    }

    public MergeContext withTolerance(QSpaceTolerance newTolerance) {
        return new MergeContext(b0Threshold, harmonizeB0Intensities, b0IntensityReference,
            Objects.requireNonNull(newTolerance, "tolerance must not be null"));
    }
}
