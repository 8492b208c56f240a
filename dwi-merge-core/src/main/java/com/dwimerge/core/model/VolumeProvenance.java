package com.dwimerge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Where one output volume of a merge came from.
 *
 * <p>A concatenated or unpaired volume has a single source; an averaged volume lists
 * the pair it was computed from, the anchor (earlier) volume first.
 *
 * @param sources contributing volumes
 */
public record VolumeProvenance(List<VolumeSource> sources) {

    /**
     * Compact constructor with validation.
     */
    public VolumeProvenance {
        Objects.requireNonNull(sources, "sources must not be null");
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("At least one source volume required");
        }
        sources = List.copyOf(sources);
    }

    public static VolumeProvenance single(String groupId, int volumeIndex) {
        return new VolumeProvenance(List.of(new VolumeSource(groupId, volumeIndex)));
    }

    public static VolumeProvenance pair(VolumeSource anchor, VolumeSource partner) {
        return new VolumeProvenance(List.of(anchor, partner));
    }

    public boolean isAveraged() {
        return sources.size() > 1;
    }

    public VolumeSource anchor() {
        return sources.get(0);
    }
}
