package com.dwimerge.core.config;

import com.dwimerge.core.denoise.DenoiseSettings;
import com.dwimerge.core.error.ConfigException;
import com.dwimerge.core.merge.MergeContext;
import com.dwimerge.core.merge.MergeStrategyType;
import com.dwimerge.core.merge.QSpaceTolerance;
import com.dwimerge.core.model.AcquisitionGroupSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a {@link MergeConfig} eagerly and turns it into {@link MergeSettings}.
 *
 * <p>Every problem is reported as a {@link ConfigException} naming the offending key,
 * before any input is read or any merge runs.
 */
public final class MergeConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(MergeConfigValidator.class);

    private MergeConfigValidator() {
        // Utility class
    }

    /**
     * Validates the configuration.
     *
     * @param config loaded configuration
     * @param baseDirectory directory relative output paths are resolved against
     * @return validated settings
     * @throws ConfigException on the first invalid or contradictory value
     */
    public static MergeSettings validate(MergeConfig config, Path baseDirectory) {
        MergeConfig.MergingConfig merging = config.mergingOrDefaults();
        MergeStrategyType strategy = merging.strategy() == null
            ? MergeStrategyType.AVERAGE
            : MergeStrategyType.parse(merging.strategy());

        double b0Threshold = merging.b0Threshold() != null ? merging.b0Threshold() : MergeContext.DEFAULT_B0_THRESHOLD;
        requireThat(Double.isFinite(b0Threshold) && b0Threshold >= 0, "b0_threshold",
            "must be a non-negative number, got " + b0Threshold);

        Double reference = merging.b0IntensityReference();
        requireThat(reference == null || (Double.isFinite(reference) && reference > 0), "b0_intensity_reference",
            "must be positive, got " + reference);

        double bTolerance = merging.bValueTolerance() != null
            ? merging.bValueTolerance() : QSpaceTolerance.DEFAULT_B_VALUE_TOLERANCE;
        requireThat(Double.isFinite(bTolerance) && bTolerance >= 0, "b_value_tolerance",
            "must be a non-negative number, got " + bTolerance);

        double angle = merging.directionToleranceDegrees() != null
            ? merging.directionToleranceDegrees() : QSpaceTolerance.DEFAULT_DIRECTION_TOLERANCE_DEGREES;
        requireThat(angle >= 0 && angle < 90, "direction_tolerance_degrees",
            "must be in [0, 90), got " + angle);

        boolean antipodal = merging.antipodalMatching() == null || merging.antipodalMatching();
        boolean harmonize = merging.harmonizeB0Intensities() == null || merging.harmonizeB0Intensities();

        MergeConfig.DenoiseConfig denoiseConfig = config.denoiseOrDefaults();
        DenoiseSettings denoise = DenoiseSettings.of(
            denoiseConfig.window(), denoiseConfig.beforeCombining(), config.combineAllDwisOrDefault());

        int threads = config.threadsOrDefault();
        requireThat(threads >= 1, "threads", "must be at least 1, got " + threads);

        validateGroups(config.groupsOrEmpty());

        MergeConfig.OutputConfig output = config.outputOrDefaults();
        Path outputDirectory = baseDirectory.resolve(output.directoryOrDefault()).normalize();
        Path reportlets = output.reportletsDirectory() != null
            ? baseDirectory.resolve(output.reportletsDirectory()).normalize()
            : outputDirectory.resolve("reportlets");

        MergeContext context = new MergeContext(b0Threshold, harmonize, reference,
            new QSpaceTolerance(bTolerance, angle, antipodal));
        log.debug("Validated configuration: strategy={}, denoise window={}, threads={}",
            strategy.id(), denoise.window(), threads);
        return new MergeSettings(strategy, context, denoise, threads, outputDirectory, reportlets,
            output.prefixOrDefault(), output.sourceFile());
    }

    private static void validateGroups(List<MergeConfig.GroupConfig> groups) {
        if (groups.isEmpty()) {
            throw new ConfigException("groups", "At least one acquisition group must be configured");
        }
        Set<String> ids = new HashSet<>();
        for (MergeConfig.GroupConfig group : groups) {
            if (group.id() == null || group.id().isBlank()) {
                throw new ConfigException("groups", "Every group needs an id");
            }
            if (!ids.add(AcquisitionGroupSet.sanitize(group.id()))) {
                throw new ConfigException("groups", "Group id '" + group.id() + "' is used twice");
            }
        }
    }

    private static void requireThat(boolean condition, String key, String message) {
        if (!condition) {
            throw new ConfigException(key, key + " " + message);
        }
    }
}
