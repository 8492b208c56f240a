package com.dwimerge.core.denoise;

import com.dwimerge.core.model.DwiImage;

/**
 * Removes thermal noise from a DWI series.
 *
 * <p>Implementations must not modify the input and must return an image with the same
 * grid and volume count.
 */
public interface Denoiser {

    /**
     * Unique identifier, e.g. {@code dwidenoise}.
     *
     * @return denoiser id
     */
    String getId();

    /**
     * Denoises a series.
     *
     * @param image series to denoise
     * @param settings validated settings, enabled
     * @param label name of the series in logs and temporary files, e.g. a group id
     * @return denoised series and its noise map
     */
    DenoiseResult denoise(DwiImage image, DenoiseSettings settings, String label);
}
