package com.dwimerge.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A 4D image: a list of 3D volumes sampled on a common {@link SpatialGrid}.
 *
 * <p>Each volume is a flat {@code float[]} in x-fastest order with exactly
 * {@link SpatialGrid#voxelCount()} elements. Volume arrays are treated as
 * immutable once the image is built; operations always allocate new arrays.
 *
 * @param grid spatial geometry of every volume
 * @param volumes voxel data, one array per volume
 */
public record DwiImage(SpatialGrid grid, List<float[]> volumes) {

    /**
     * Compact constructor with validation.
     */
    public DwiImage {
        Objects.requireNonNull(grid, "grid must not be null");
        Objects.requireNonNull(volumes, "volumes must not be null");
        int expected = grid.voxelCount();
        for (int i = 0; i < volumes.size(); i++) {
            float[] volume = volumes.get(i);
            if (volume == null || volume.length != expected) {
                throw new IllegalArgumentException("Volume " + i + " has "
                    + (volume == null ? "no data" : volume.length + " voxels")
                    + ", grid " + grid.describe() + " needs " + expected);
            }
        }
        volumes = List.copyOf(volumes);
    }

    /**
     * Creates a single-volume image, e.g. a b0 reference or a mask.
     *
     * @param grid spatial geometry
     * @param data voxel data
     * @return 3D image
     */
    public static DwiImage single(SpatialGrid grid, float[] data) {
        return new DwiImage(grid, List.of(data));
    }

    public int volumeCount() {
        return volumes.size();
    }

    public float[] volume(int index) {
        return volumes.get(index);
    }

    /**
     * Returns a new image holding the given volumes of this image, in order.
     *
     * @param indices volume indices to keep
     * @return subset image
     */
    public DwiImage select(List<Integer> indices) {
        List<float[]> selected = new ArrayList<>(indices.size());
        for (int index : indices) {
            selected.add(volumes.get(index));
        }
        return new DwiImage(grid, selected);
    }
}
