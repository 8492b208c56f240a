package com.dwimerge.core.model;

import java.util.Objects;

/**
 * Points at one volume of one acquisition group.
 *
 * @param groupId sanitized group identifier
 * @param volumeIndex zero-based volume index within that group
 */
public record VolumeSource(String groupId, int volumeIndex) {

    /**
     * Compact constructor with validation.
     */
    public VolumeSource {
        Objects.requireNonNull(groupId, "groupId must not be null");
        if (volumeIndex < 0) {
            throw new IllegalArgumentException("volumeIndex must be >= 0");
        }
    }

    @Override
    public String toString() {
        return groupId + "[" + volumeIndex + "]";
    }
}
