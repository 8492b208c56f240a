package com.dwimerge.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The seven artifacts every acquisition group must provide.
 *
 * <p>The suffix forms the external slot name {@code {group}{suffix}}, e.g.
 * {@code dir_AP_original_bvec}.
 */
public enum ArtifactSlot {
    IMAGE("_image"),
    BVAL("_bval"),
    BVEC("_bvec"),
    ORIGINAL_BVEC("_original_bvec"),
    ORIGINAL_IMAGE("_original_image"),
    RAW_CONCATENATED_IMAGE("_raw_concatenated_image"),
    B0_REF("_b0_ref");

    private final String suffix;

    ArtifactSlot(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * Builds the external slot name for a group.
     *
     * @param groupId sanitized group identifier
     * @return slot name such as {@code dir_AP_bval}
     */
    public String slotName(String groupId) {
        return groupId + suffix;
    }

    /**
     * Finds the slot whose suffix ends the given slot name. Longest suffix wins so that
     * {@code x_original_bvec} resolves to {@link #ORIGINAL_BVEC} rather than {@link #BVEC}.
     *
     * @param slotName external slot name
     * @return matching slot, if any
     */
    public static Optional<ArtifactSlot> fromSlotName(String slotName) {
        return Arrays.stream(values())
            .filter(slot -> slotName.endsWith(slot.suffix))
            .max((a, b) -> Integer.compare(a.suffix.length(), b.suffix.length()));
    }

    public static List<ArtifactSlot> required() {
        return List.of(values());
    }
}
