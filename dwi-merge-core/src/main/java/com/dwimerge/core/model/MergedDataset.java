package com.dwimerge.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Result of combining all acquisition groups into one series.
 *
 * @param strategyId identifier of the strategy that produced this dataset
 * @param image merged DWI series
 * @param bvals one b-value per merged volume
 * @param bvecs one b-vector per merged volume
 * @param provenance one entry per merged volume
 * @param groupOrder contributing group identifiers in merge order
 * @param rawConcatenatedImage raw inputs of every group concatenated in group order (QC input)
 * @param b0Reference voxelwise mean of the group b=0 references
 */
public record MergedDataset(
    String strategyId,
    DwiImage image,
    List<Double> bvals,
    List<Vector3> bvecs,
    List<VolumeProvenance> provenance,
    List<String> groupOrder,
    DwiImage rawConcatenatedImage,
    DwiImage b0Reference
) {
    /**
     * Compact constructor with validation.
     */
    public MergedDataset {
        Objects.requireNonNull(strategyId, "strategyId must not be null");
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(bvals, "bvals must not be null");
        Objects.requireNonNull(bvecs, "bvecs must not be null");
        Objects.requireNonNull(provenance, "provenance must not be null");
        Objects.requireNonNull(groupOrder, "groupOrder must not be null");
        Objects.requireNonNull(rawConcatenatedImage, "rawConcatenatedImage must not be null");
        Objects.requireNonNull(b0Reference, "b0Reference must not be null");
        int volumes = image.volumeCount();
        if (bvals.size() != volumes || bvecs.size() != volumes || provenance.size() != volumes) {
            throw new IllegalArgumentException(String.format(
                "Merged tables disagree: %d volumes, %d bvals, %d bvecs, %d provenance entries",
                volumes, bvals.size(), bvecs.size(), provenance.size()));
        }
        bvals = List.copyOf(bvals);
        bvecs = List.copyOf(bvecs);
        provenance = List.copyOf(provenance);
        groupOrder = List.copyOf(groupOrder);
    }

    public int volumeCount() {
        return image.volumeCount();
    }

    public long averagedVolumeCount() {
        return provenance.stream().filter(VolumeProvenance::isAveraged).count();
    }

    /**
     * Returns a copy with a different merged image, e.g. after post-merge denoising.
     *
     * @param replacement image with the same volume count
     * @return updated dataset
     */
    public MergedDataset withImage(DwiImage replacement) {
        return new MergedDataset(strategyId, replacement, bvals, bvecs, provenance,
            groupOrder, rawConcatenatedImage, b0Reference);
    }

    /**
     * Groups that contributed at least one volume, in merge order.
     *
     * @return contributing group identifiers
     */
    public List<String> contributingGroups() {
        LinkedHashSet<String> ids = new LinkedHashSet<>();
        provenance.forEach(p -> p.sources().forEach(s -> ids.add(s.groupId())));
        return List.copyOf(ids);
    }
}
