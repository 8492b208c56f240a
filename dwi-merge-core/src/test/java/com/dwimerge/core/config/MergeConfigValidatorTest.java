package com.dwimerge.core.config;

import com.dwimerge.core.error.ConfigException;
import com.dwimerge.core.merge.MergeStrategyType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MergeConfigValidator}.
 */
class MergeConfigValidatorTest {

    @TempDir
    Path tempDir;

    private static final List<MergeConfig.GroupConfig> GROUPS = List.of(group("dir-AP"), group("dir-PA"));

    private static MergeConfig.GroupConfig group(String id) {
        return new MergeConfig.GroupConfig(id, null, null, null, null, null, null, null, null);
    }

    private static MergeConfig.MergingConfig merging(String strategy, Double b0Threshold, Double bTolerance, Double angle) {
        return new MergeConfig.MergingConfig(strategy, null, b0Threshold, null, bTolerance, angle, null);
    }

    private static MergeConfig config(MergeConfig.MergingConfig merging, MergeConfig.DenoiseConfig denoise,
                                      Boolean combineAllDwis, Integer threads, List<MergeConfig.GroupConfig> groups) {
        return new MergeConfig(merging, denoise, combineAllDwis, threads, null, null, null, groups);
    }

    private static String subjectOf(Throwable e) {
        return ((ConfigException) e).getSubject();
    }

    @Test
    void validate_defaults_selectAverageWithStandardTolerances() {
        MergeSettings settings = MergeConfigValidator.validate(config(null, null, null, null, GROUPS), tempDir);

        assertThat(settings.strategy()).isEqualTo(MergeStrategyType.AVERAGE);
        assertThat(settings.mergeContext().b0Threshold()).isEqualTo(100.0);
        assertThat(settings.mergeContext().tolerance().bValueTolerance()).isEqualTo(50.0);
        assertThat(settings.mergeContext().tolerance().directionToleranceDegrees()).isEqualTo(5.0);
        assertThat(settings.mergeContext().tolerance().antipodalMatching()).isTrue();
        assertThat(settings.denoise().isEnabled()).isFalse();
        assertThat(settings.threads()).isEqualTo(1);
        assertThat(settings.outputDirectory()).isEqualTo(tempDir.resolve("derivatives"));
        assertThat(settings.reportletsDirectory()).isEqualTo(tempDir.resolve("derivatives").resolve("reportlets"));
        assertThat(settings.prefix()).isEqualTo("dwi");
    }

    @Test
    void validate_concatenateSelector_selectsConcatenation() {
        MergeSettings settings = MergeConfigValidator.validate(
            config(merging("Concatenate", null, null, null), null, null, null, GROUPS), tempDir);

        assertThat(settings.strategy()).isEqualTo(MergeStrategyType.CONCATENATE);
    }

    @Test
    void validate_unknownStrategy_throwsConfigException() {
        assertThatThrownBy(() -> MergeConfigValidator.validate(
            config(merging("median", null, null, null), null, null, null, GROUPS), tempDir))
            .isInstanceOf(ConfigException.class)
            .extracting(MergeConfigValidatorTest::subjectOf)
            .isEqualTo("merging_strategy");
    }

    @Test
    void validate_negativeB0Threshold_throwsConfigException() {
        assertThatThrownBy(() -> MergeConfigValidator.validate(
            config(merging(null, -1.0, null, null), null, null, null, GROUPS), tempDir))
            .extracting(MergeConfigValidatorTest::subjectOf)
            .isEqualTo("b0_threshold");
    }

    @Test
    void validate_rightAngleTolerance_throwsConfigException() {
        assertThatThrownBy(() -> MergeConfigValidator.validate(
            config(merging(null, null, null, 90.0), null, null, null, GROUPS), tempDir))
            .extracting(MergeConfigValidatorTest::subjectOf)
            .isEqualTo("direction_tolerance_degrees");
    }

    @Test
    void validate_evenDenoiseWindow_throwsConfigException() {
        assertThatThrownBy(() -> MergeConfigValidator.validate(
            config(null, new MergeConfig.DenoiseConfig(4, false), null, null, GROUPS), tempDir))
            .extracting(MergeConfigValidatorTest::subjectOf)
            .isEqualTo("dwi_denoise_window");
    }

    @Test
    void validate_denoiseBeforeCombiningWithoutCombinedDwis_throwsConfigException() {
        assertThatThrownBy(() -> MergeConfigValidator.validate(
            config(null, new MergeConfig.DenoiseConfig(7, true), false, null, GROUPS), tempDir))
            .extracting(MergeConfigValidatorTest::subjectOf)
            .isEqualTo("denoise_before_combining");
    }

    @Test
    void validate_zeroThreads_throwsConfigException() {
        assertThatThrownBy(() -> MergeConfigValidator.validate(config(null, null, null, 0, GROUPS), tempDir))
            .extracting(MergeConfigValidatorTest::subjectOf)
            .isEqualTo("threads");
    }

    @Test
    void validate_noGroups_throwsConfigException() {
        assertThatThrownBy(() -> MergeConfigValidator.validate(config(null, null, null, null, List.of()), tempDir))
            .extracting(MergeConfigValidatorTest::subjectOf)
            .isEqualTo("groups");
    }

    @Test
    void validate_idsEqualAfterSanitizing_throwsConfigException() {
        assertThatThrownBy(() -> MergeConfigValidator.validate(
            config(null, null, null, null, List.of(group("dir-AP"), group("dir_AP"))), tempDir))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("used twice");
    }
}
