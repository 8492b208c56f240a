package com.dwimerge.core.model;

import com.dwimerge.core.error.ValidationException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Ordered, validated collection of acquisition groups for one subject/session.
 *
 * <p>Built once from externally resolved artifacts and immutable afterwards. The
 * group order is the order of the identifiers passed to {@link #build}; every
 * per-slot sequence exposed by this set follows that order, so the merge strategy
 * sees index {@code i} of every sequence as the same group.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Map<String, Map<ArtifactSlot, Object>> values = new LinkedHashMap<>();
 * values.put("dir-AP", apSlots);
 * values.put("dir-PA", paSlots);
 * AcquisitionGroupSet groups = AcquisitionGroupSet.build(List.of("dir-AP", "dir-PA"), values, Map.of());
 * groups.ids();   // [dir_AP, dir_PA]
 * }</pre>
 *
 * @param groups groups in stable order
 */
public record AcquisitionGroupSet(List<AcquisitionGroup> groups) {

    /**
     * Compact constructor with validation.
     */
    public AcquisitionGroupSet {
        Objects.requireNonNull(groups, "groups must not be null");
        groups = List.copyOf(groups);
    }

    /**
     * Replaces characters that are not valid in slot names. Mirrors the rule used by
     * the upstream input resolver: dashes become underscores.
     *
     * @param groupId raw group identifier
     * @return sanitized identifier
     */
    public static String sanitize(String groupId) {
        return groupId.trim().replace('-', '_');
    }

    /**
     * Builds a validated set from per-group slot values.
     *
     * <p>Slot value types: {@link DwiImage} for image slots, {@code List<Double>} for
     * {@link ArtifactSlot#BVAL}, {@code List<Vector3>} for the two b-vector slots.
     *
     * @param groupIds group identifiers in the desired order (raw or sanitized)
     * @param fieldValues slot values keyed by the same identifiers
     * @param confounds optional confound tables keyed by the same identifiers
     * @return validated set
     * @throws ValidationException if a group is missing, duplicated, lacks a slot, holds a
     *     value of the wrong type or has image and gradient tables of different lengths
     */
    public static AcquisitionGroupSet build(
        List<String> groupIds,
        Map<String, Map<ArtifactSlot, Object>> fieldValues,
        Map<String, ConfoundTable> confounds
    ) {
        Objects.requireNonNull(groupIds, "groupIds must not be null");
        Objects.requireNonNull(fieldValues, "fieldValues must not be null");
        Map<String, ConfoundTable> confoundsById = confounds == null ? Map.of() : confounds;

        if (groupIds.isEmpty()) {
            throw new ValidationException("groups", "At least one acquisition group is required");
        }

        Set<String> seen = new HashSet<>();
        List<AcquisitionGroup> built = new ArrayList<>(groupIds.size());
        for (String rawId : groupIds) {
            String id = sanitize(rawId);
            if (id.isEmpty()) {
                throw new ValidationException("groups", "Group identifier must not be blank");
            }
            if (!seen.add(id)) {
                throw new ValidationException(id, "Duplicate group identifier after sanitizing '" + rawId + "'");
            }
            Map<ArtifactSlot, Object> slots = lookup(fieldValues, rawId, id);
            if (slots == null) {
                throw new ValidationException(id, "No artifacts supplied for group");
            }
            ConfoundTable groupConfounds = lookup(confoundsById, rawId, id);
            built.add(buildGroup(id, slots, groupConfounds));
        }
        return new AcquisitionGroupSet(built);
    }

    /**
     * Builds a set from the flat naming contract where every artifact is addressed as
     * {@code {group}{suffix}}, e.g. {@code dir_AP_image}.
     *
     * @param groupIds group identifiers in the desired order
     * @param namedSlots values keyed by slot name
     * @return validated set
     * @throws ValidationException if a slot is missing for any group
     */
    public static AcquisitionGroupSet fromNamedSlots(List<String> groupIds, Map<String, Object> namedSlots) {
        Map<String, Map<ArtifactSlot, Object>> fieldValues = new LinkedHashMap<>();
        for (String rawId : groupIds) {
            String id = sanitize(rawId);
            Map<ArtifactSlot, Object> slots = new EnumMap<>(ArtifactSlot.class);
            for (ArtifactSlot slot : ArtifactSlot.values()) {
                Object value = namedSlots.get(slot.slotName(id));
                if (value != null) {
                    slots.put(slot, value);
                }
            }
            fieldValues.put(id, slots);
        }
        return build(groupIds, fieldValues, Map.of());
    }

    public int size() {
        return groups.size();
    }

    public AcquisitionGroup get(int index) {
        return groups.get(index);
    }

    public List<String> ids() {
        return project(AcquisitionGroup::id);
    }

    public List<DwiImage> images() {
        return project(AcquisitionGroup::image);
    }

    public List<List<Double>> bvals() {
        return project(AcquisitionGroup::bvals);
    }

    public List<List<Vector3>> bvecs() {
        return project(AcquisitionGroup::bvecs);
    }

    public List<List<Vector3>> originalBvecs() {
        return project(AcquisitionGroup::originalBvecs);
    }

    public List<DwiImage> originalImages() {
        return project(AcquisitionGroup::originalImage);
    }

    public List<DwiImage> rawConcatenatedImages() {
        return project(AcquisitionGroup::rawConcatenatedImage);
    }

    public List<DwiImage> b0References() {
        return project(AcquisitionGroup::b0Reference);
    }

    /**
     * Returns the ordered values of one slot across all groups.
     *
     * @param slot artifact slot
     * @return one value per group, in group order
     */
    public List<Object> slotValues(ArtifactSlot slot) {
        return switch (slot) {
            case IMAGE -> List.copyOf(images());
            case BVAL -> List.copyOf(bvals());
            case BVEC -> List.copyOf(bvecs());
            case ORIGINAL_BVEC -> List.copyOf(originalBvecs());
            case ORIGINAL_IMAGE -> List.copyOf(originalImages());
            case RAW_CONCATENATED_IMAGE -> List.copyOf(rawConcatenatedImages());
            case B0_REF -> List.copyOf(b0References());
        };
    }

    public int totalVolumeCount() {
        return groups.stream().mapToInt(AcquisitionGroup::volumeCount).sum();
    }

    /**
     * Returns a new set where each group was transformed, keeping order.
     *
     * @param transform per-group transformation
     * @return transformed set
     */
    public AcquisitionGroupSet map(Function<AcquisitionGroup, AcquisitionGroup> transform) {
        return new AcquisitionGroupSet(groups.stream().map(transform).toList());
    }

    private <T> List<T> project(Function<AcquisitionGroup, T> accessor) {
        return groups.stream().map(accessor).toList();
    }

    private static <V> V lookup(Map<String, V> values, String rawId, String sanitizedId) {
        V value = values.get(rawId);
        return value != null ? value : values.get(sanitizedId);
    }

    private static AcquisitionGroup buildGroup(String id, Map<ArtifactSlot, Object> slots, ConfoundTable confounds) {
        List<String> missing = ArtifactSlot.required().stream()
            .filter(slot -> slots.get(slot) == null)
            .map(slot -> slot.slotName(id))
            .toList();
        if (!missing.isEmpty()) {
            throw new ValidationException(id, "Missing required artifact slot(s): " + String.join(", ", missing));
        }

        DwiImage image = imageSlot(id, slots, ArtifactSlot.IMAGE);
        List<Double> bvals = listSlot(id, slots, ArtifactSlot.BVAL, Double.class);
        List<Vector3> bvecs = listSlot(id, slots, ArtifactSlot.BVEC, Vector3.class);
        List<Vector3> originalBvecs = listSlot(id, slots, ArtifactSlot.ORIGINAL_BVEC, Vector3.class);
        DwiImage originalImage = imageSlot(id, slots, ArtifactSlot.ORIGINAL_IMAGE);
        DwiImage rawConcatenated = imageSlot(id, slots, ArtifactSlot.RAW_CONCATENATED_IMAGE);
        DwiImage b0Reference = imageSlot(id, slots, ArtifactSlot.B0_REF);

        int volumes = image.volumeCount();
        if (volumes == 0) {
            throw new ValidationException(id, "Image " + ArtifactSlot.IMAGE.slotName(id) + " has no volumes");
        }
        if (bvals.size() != volumes || bvecs.size() != volumes) {
            throw new ValidationException(id, String.format(
                "Volume count mismatch: image has %d volumes, bval has %d rows, bvec has %d rows",
                volumes, bvals.size(), bvecs.size()));
        }
        if (rawConcatenated.volumeCount() != volumes) {
            throw new ValidationException(id, String.format(
                "Volume count mismatch: image has %d volumes, %s has %d",
                volumes, ArtifactSlot.RAW_CONCATENATED_IMAGE.slotName(id), rawConcatenated.volumeCount()));
        }
        if (!rawConcatenated.grid().matches(image.grid())) {
            throw new ValidationException(id, "Raw concatenated image grid " + rawConcatenated.grid().describe()
                + " differs from image grid " + image.grid().describe());
        }
        if (b0Reference.volumeCount() != 1) {
            throw new ValidationException(id, "b=0 reference must be a single volume, found "
                + b0Reference.volumeCount());
        }
        if (!b0Reference.grid().matches(image.grid())) {
            throw new ValidationException(id, "b=0 reference grid " + b0Reference.grid().describe()
                + " differs from image grid " + image.grid().describe());
        }
        if (confounds != null && confounds.rowCount() > 0 && confounds.rowCount() != volumes) {
            throw new ValidationException(id, "Confounds have " + confounds.rowCount()
                + " rows but the image has " + volumes + " volumes");
        }

        return new AcquisitionGroup(id, image, bvals, bvecs, originalBvecs,
            originalImage, rawConcatenated, b0Reference, confounds);
    }

    private static DwiImage imageSlot(String id, Map<ArtifactSlot, Object> slots, ArtifactSlot slot) {
        Object value = slots.get(slot);
        if (value instanceof DwiImage image) {
            return image;
        }
        throw new ValidationException(id, "Slot " + slot.slotName(id) + " must hold an image, got "
            + value.getClass().getSimpleName());
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> listSlot(String id, Map<ArtifactSlot, Object> slots, ArtifactSlot slot, Class<T> type) {
        Object value = slots.get(slot);
        if (!(value instanceof List<?> list)) {
            throw new ValidationException(id, "Slot " + slot.slotName(id) + " must hold a table, got "
                + value.getClass().getSimpleName());
        }
        for (Object row : list) {
            if (!type.isInstance(row)) {
                throw new ValidationException(id, "Slot " + slot.slotName(id) + " contains a "
                    + (row == null ? "null" : row.getClass().getSimpleName()) + " row, expected "
                    + type.getSimpleName());
            }
        }
        return (List<T>) list;
    }
}
