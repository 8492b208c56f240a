package com.dwimerge.core.merge;

import com.dwimerge.core.error.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Looks up {@link MergeStrategy} implementations registered via SPI.
 */
public final class MergeStrategies {

    private static final Logger log = LoggerFactory.getLogger(MergeStrategies.class);

    private MergeStrategies() {
        // Utility class
    }

    /**
     * Discovers all registered strategies, ordered by type.
     *
     * @return available strategies
     */
    public static List<MergeStrategy> available() {
        ServiceLoader<MergeStrategy> loader = ServiceLoader.load(MergeStrategy.class);
        List<MergeStrategy> strategies = new ArrayList<>();
        loader.forEach(strategies::add);
        strategies.sort(Comparator.comparing(MergeStrategy::getType));
        log.debug("Discovered {} merge strategies", strategies.size());
        return strategies;
    }

    /**
     * Returns the strategy implementing the given type.
     *
     * @param type strategy type
     * @return strategy instance
     * @throws ConfigException if no implementation is registered
     */
    public static MergeStrategy forType(MergeStrategyType type) {
        return available().stream()
            .filter(strategy -> strategy.getType() == type)
            .findFirst()
            .orElseThrow(() -> new ConfigException(MergeStrategyType.CONFIG_KEY,
                "No merge strategy registered for '" + type.id() + "'"));
    }

    /**
     * Parses the selector and returns the matching strategy.
     *
     * @param selector configured strategy value
     * @return strategy instance
     * @throws ConfigException if the selector is unknown
     */
    public static MergeStrategy forSelector(String selector) {
        return forType(MergeStrategyType.parse(selector));
    }
}
