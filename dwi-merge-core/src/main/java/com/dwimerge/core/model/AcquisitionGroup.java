package com.dwimerge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One distortion (phase-encoding) group after its own correction.
 *
 * <p>Carries the seven required artifacts of {@link ArtifactSlot} plus optional
 * confounds. Structural consistency between artifacts is checked by
 * {@link AcquisitionGroupSet#build}; this record only rejects nulls.
 *
 * @param id sanitized group identifier
 * @param image corrected DWI series in final space
 * @param bvals one b-value per volume of {@code image}
 * @param bvecs final (possibly rotated) b-vectors, one per volume
 * @param originalBvecs b-vectors before motion correction, used for cross-group matching
 * @param originalImage the uncorrected input series
 * @param rawConcatenatedImage raw inputs of the group concatenated, used for QC
 * @param b0Reference single-volume b=0 reference
 * @param confounds per-volume confounds, may be {@code null}
 */
public record AcquisitionGroup(
    String id,
    DwiImage image,
    List<Double> bvals,
    List<Vector3> bvecs,
    List<Vector3> originalBvecs,
    DwiImage originalImage,
    DwiImage rawConcatenatedImage,
    DwiImage b0Reference,
    ConfoundTable confounds
) {
    /**
     * Compact constructor with validation.
     */
    public AcquisitionGroup {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(bvals, "bvals must not be null");
        Objects.requireNonNull(bvecs, "bvecs must not be null");
        Objects.requireNonNull(originalBvecs, "originalBvecs must not be null");
        Objects.requireNonNull(originalImage, "originalImage must not be null");
        Objects.requireNonNull(rawConcatenatedImage, "rawConcatenatedImage must not be null");
        Objects.requireNonNull(b0Reference, "b0Reference must not be null");
        bvals = List.copyOf(bvals);
        bvecs = List.copyOf(bvecs);
        originalBvecs = List.copyOf(originalBvecs);
    }

    public int volumeCount() {
        return image.volumeCount();
    }

    /**
     * Returns a copy of this group with a different final image, e.g. after denoising.
     *
     * @param replacement new image with the same volume count
     * @return updated group
     */
    public AcquisitionGroup withImage(DwiImage replacement) {
        return new AcquisitionGroup(id, replacement, bvals, bvecs, originalBvecs,
            originalImage, rawConcatenatedImage, b0Reference, confounds);
    }
}
