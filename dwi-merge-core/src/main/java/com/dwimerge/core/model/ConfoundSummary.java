package com.dwimerge.core.model;

/**
 * Motion summary of a series, as reported in the series QC row.
 *
 * <p>Missing inputs yield {@link Double#NaN}.
 *
 * @param meanFramewiseDisplacement mean framewise displacement (mm)
 * @param maxFramewiseDisplacement max framewise displacement (mm)
 * @param maxRotation largest absolute rotation from the reference (rad)
 * @param maxTranslation largest absolute translation from the reference (mm)
 * @param maxRelativeRotation largest volume-to-volume rotation change (rad)
 * @param maxRelativeTranslation largest volume-to-volume translation change (mm)
 */
public record ConfoundSummary(
    double meanFramewiseDisplacement,
    double maxFramewiseDisplacement,
    double maxRotation,
    double maxTranslation,
    double maxRelativeRotation,
    double maxRelativeTranslation
) {
    public static ConfoundSummary unavailable() {
        return new ConfoundSummary(Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }
}
