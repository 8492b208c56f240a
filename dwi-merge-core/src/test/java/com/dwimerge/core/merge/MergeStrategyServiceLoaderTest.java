package com.dwimerge.core.merge;

import com.dwimerge.core.error.ConfigException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration test validating SPI registration for {@link MergeStrategy} implementations.
 */
class MergeStrategyServiceLoaderTest {

    @Test
    void serviceLoader_discoversBothStrategies() {
        List<MergeStrategy> strategies = ServiceLoader.load(MergeStrategy.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(strategies)
            .extracting(MergeStrategy::getId)
            .containsExactlyInAnyOrder("average", "concat");
    }

    @Test
    void available_ordersByType() {
        assertThat(MergeStrategies.available())
            .extracting(MergeStrategy::getType)
            .containsExactly(MergeStrategyType.AVERAGE, MergeStrategyType.CONCATENATE);
    }

    @Test
    void forSelector_concatVariant_returnsConcatenatingStrategy() {
        assertThat(MergeStrategies.forSelector("Concatenate")).isInstanceOf(ConcatenatingMergeStrategy.class);
    }

    @Test
    void forSelector_unknown_throwsConfigException() {
        assertThatThrownBy(() -> MergeStrategies.forSelector("median")).isInstanceOf(ConfigException.class);
    }
}
