package com.dwimerge.core.denoise;

import com.dwimerge.core.error.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DenoiseSettings}.
 */
class DenoiseSettingsTest {

    @ParameterizedTest
    @ValueSource(ints = {2, 4, -1, -3})
    void constructor_evenOrNegativeWindow_throwsConfigException(int window) {
        assertThatThrownBy(() -> new DenoiseSettings(window, false))
            .isInstanceOf(ConfigException.class)
            .extracting(e -> ((ConfigException) e).getSubject())
            .isEqualTo(DenoiseSettings.WINDOW_KEY);
    }

    @Test
    void constructor_zeroWindow_isDisabled() {
        assertThat(new DenoiseSettings(0, false).isEnabled()).isFalse();
        assertThat(DenoiseSettings.disabled().isEnabled()).isFalse();
    }

    @Test
    void extent_repeatsWindowOnEveryAxis() {
        assertThat(new DenoiseSettings(5, false).extent()).isEqualTo("5,5,5");
    }

    @Test
    void of_beforeCombiningWithoutCombinedDwis_throwsConfigException() {
        assertThatThrownBy(() -> DenoiseSettings.of(7, true, false))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("combine_all_dwis");
    }

    @Test
    void of_beforeCombiningWithZeroWindow_stillRejected() {
        assertThatThrownBy(() -> DenoiseSettings.of(0, true, false))
            .isInstanceOf(ConfigException.class);
    }

    @Test
    void of_nullValues_defaultToDisabled() {
        assertThat(DenoiseSettings.of(null, null, false)).isEqualTo(DenoiseSettings.disabled());
    }

    @Test
    void of_beforeCombiningWithCombinedDwis_isAccepted() {
        DenoiseSettings settings = DenoiseSettings.of(5, true, true);

        assertThat(settings.beforeMerge()).isTrue();
        assertThat(settings.window()).isEqualTo(5);
    }
}
