package com.dwimerge.core.merge;

import com.dwimerge.core.model.AcquisitionGroupSet;
import com.dwimerge.core.model.MergedDataset;

/**
 * Combines all acquisition groups of a run into one {@link MergedDataset}.
 *
 * <p>Strategies are discovered via Java Service Provider Interface (SPI) and are
 * stateless: every setting arrives in the {@link MergeContext}. The strategy is
 * selected once per run from {@link MergeStrategyType} and invoked exactly once.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.dwimerge.core.merge.MergeStrategy}
 *
 * @see MergeStrategies
 */
public interface MergeStrategy {

    /**
     * Returns the type this strategy implements.
     *
     * @return strategy type
     */
    MergeStrategyType getType();

    /**
     * Returns unique identifier, equal to the configuration value that selects it.
     *
     * @return strategy identifier
     */
    default String getId() {
        return getType().id();
    }

    /**
     * Returns human-readable name for CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Merges the groups.
     *
     * @param groups validated acquisition groups in merge order
     * @param context merge settings
     * @return merged dataset
     * @throws com.dwimerge.core.error.ValidationException if the groups violate the strategy's preconditions
     */
    MergedDataset merge(AcquisitionGroupSet groups, MergeContext context);
}
