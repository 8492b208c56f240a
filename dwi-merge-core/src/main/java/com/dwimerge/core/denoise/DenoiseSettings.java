package com.dwimerge.core.denoise;

import com.dwimerge.core.error.ConfigException;

/**
 * Validated denoising settings.
 *
 * @param window cubic patch extent in voxels; 0 disables denoising
 * @param beforeMerge denoise every group before merging instead of the merged series
 */
public record DenoiseSettings(int window, boolean beforeMerge) {

    public static final String WINDOW_KEY = "dwi_denoise_window";
    public static final String BEFORE_COMBINING_KEY = "denoise_before_combining";

    /**
     * Compact constructor with validation.
     */
    public DenoiseSettings {
        if (window < 0 || (window > 0 && window % 2 == 0)) {
            throw new ConfigException(WINDOW_KEY, "Denoise window must be 0 or an odd positive integer, got " + window);
        }
    }

    public static DenoiseSettings disabled() {
        return new DenoiseSettings(0, false);
    }

    /**
     * Builds settings from raw configuration values.
     *
     * <p>Denoising before combining needs the upstream series to have been combined into
     * one run per group, so it is rejected unless {@code combineAllDwis} is set, whatever
     * the window.
     *
     * @param window configured window, {@code null} for 0
     * @param beforeCombining configured flag, {@code null} for false
     * @param combineAllDwis whether upstream combined all DWI series
     * @return validated settings
     * @throws ConfigException if the window is invalid or the flags contradict each other
     */
    public static DenoiseSettings of(Integer window, Boolean beforeCombining, boolean combineAllDwis) {
        boolean before = beforeCombining != null && beforeCombining;
        if (before && !combineAllDwis) {
            throw new ConfigException(BEFORE_COMBINING_KEY,
                "Denoising before combining requires combine_all_dwis to be enabled");
        }
        return new DenoiseSettings(window == null ? 0 : window, before);
    }

    public boolean isEnabled() {
        return window > 0;
    }

    /**
     * Returns the window as an MRtrix extent argument, e.g. {@code 5,5,5}.
     *
     * @return extent string
     */
    public String extent() {
        return window + "," + window + "," + window;
    }
}
