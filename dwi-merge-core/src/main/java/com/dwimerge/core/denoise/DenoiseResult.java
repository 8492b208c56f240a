package com.dwimerge.core.denoise;

import com.dwimerge.core.model.DwiImage;

import java.util.Objects;

/**
 * Output of one denoising call.
 *
 * @param denoised denoised series, same grid and volume count as the input
 * @param noiseMap single-volume noise level estimate
 */
public record DenoiseResult(DwiImage denoised, DwiImage noiseMap) {

    /**
     * Compact constructor with validation.
     */
    public DenoiseResult {
        Objects.requireNonNull(denoised, "denoised must not be null");
        Objects.requireNonNull(noiseMap, "noiseMap must not be null");
    }
}
