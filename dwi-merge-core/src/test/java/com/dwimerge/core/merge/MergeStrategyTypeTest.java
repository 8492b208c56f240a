package com.dwimerge.core.merge;

import com.dwimerge.core.error.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MergeStrategyType}.
 */
class MergeStrategyTypeTest {

    @ParameterizedTest
    @ValueSource(strings = {"average", "AVERAGE", " Average "})
    void parse_averageAnyCase_selectsAverage(String value) {
        assertThat(MergeStrategyType.parse(value)).isEqualTo(MergeStrategyType.AVERAGE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"concat", "concatenate", "CONCATENATION"})
    void parse_concatPrefix_selectsConcatenate(String value) {
        assertThat(MergeStrategyType.parse(value)).isEqualTo(MergeStrategyType.CONCATENATE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"avg", "mean", "con", ""})
    void parse_unknownValue_throwsConfigException(String value) {
        assertThatThrownBy(() -> MergeStrategyType.parse(value))
            .isInstanceOf(ConfigException.class)
            .extracting(e -> ((ConfigException) e).getSubject())
            .isEqualTo("merging_strategy");
    }

    @Test
    void parse_null_throwsConfigException() {
        assertThatThrownBy(() -> MergeStrategyType.parse(null)).isInstanceOf(ConfigException.class);
    }
}
