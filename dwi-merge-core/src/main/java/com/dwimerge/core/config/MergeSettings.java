package com.dwimerge.core.config;

import com.dwimerge.core.denoise.DenoiseSettings;
import com.dwimerge.core.merge.MergeContext;
import com.dwimerge.core.merge.MergeStrategyType;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Typed, validated view of a {@link MergeConfig}, produced by {@link MergeConfigValidator}.
 *
 * @param strategy selected merge strategy
 * @param mergeContext thresholds and tolerances handed to the strategy
 * @param denoise denoising settings
 * @param threads worker threads of the graph runner
 * @param outputDirectory derivatives directory
 * @param reportletsDirectory directory every reportlet is written to
 * @param prefix output prefix
 * @param sourceFile identifier the derivatives are keyed by, may be {@code null}
 */
public record MergeSettings(
    MergeStrategyType strategy,
    MergeContext mergeContext,
    DenoiseSettings denoise,
    int threads,
    Path outputDirectory,
    Path reportletsDirectory,
    String prefix,
    String sourceFile
) {
    /**
     * Compact constructor with validation.
     */
    public MergeSettings {
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(mergeContext, "mergeContext must not be null");
        Objects.requireNonNull(denoise, "denoise must not be null");
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        Objects.requireNonNull(reportletsDirectory, "reportletsDirectory must not be null");
        Objects.requireNonNull(prefix, "prefix must not be null");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
    }
}
