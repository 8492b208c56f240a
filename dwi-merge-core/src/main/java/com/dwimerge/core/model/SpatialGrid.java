package com.dwimerge.core.model;

/**
 * In-plane and slice geometry shared by every volume of a 4D series.
 *
 * @param nx voxels along x
 * @param ny voxels along y
 * @param nz voxels along z (slices)
 * @param dx voxel size along x in mm
 * @param dy voxel size along y in mm
 * @param dz voxel size along z in mm
 */
public record SpatialGrid(int nx, int ny, int nz, double dx, double dy, double dz) {

    private static final double VOXEL_SIZE_TOLERANCE = 1e-4;

    /**
     * Compact constructor with validation.
     */
    public SpatialGrid {
        if (nx <= 0 || ny <= 0 || nz <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + nx + "x" + ny + "x" + nz);
        }
        if (!(dx > 0) || !(dy > 0) || !(dz > 0)) {
            throw new IllegalArgumentException("Voxel sizes must be positive: " + dx + "x" + dy + "x" + dz);
        }
    }

    /**
     * Creates a grid with 1mm isotropic voxels.
     *
     * @param nx voxels along x
     * @param ny voxels along y
     * @param nz voxels along z
     * @return grid
     */
    public static SpatialGrid isotropic(int nx, int ny, int nz) {
        return new SpatialGrid(nx, ny, nz, 1.0, 1.0, 1.0);
    }

    public int voxelCount() {
        return nx * ny * nz;
    }

    /**
     * Checks that another grid has identical dimensions and, within a small
     * tolerance, identical voxel sizes.
     *
     * @param other grid to compare
     * @return true if volumes on both grids can be combined voxelwise
     */
    public boolean matches(SpatialGrid other) {
        return nx == other.nx && ny == other.ny && nz == other.nz
            && Math.abs(dx - other.dx) < VOXEL_SIZE_TOLERANCE
            && Math.abs(dy - other.dy) < VOXEL_SIZE_TOLERANCE
            && Math.abs(dz - other.dz) < VOXEL_SIZE_TOLERANCE;
    }

    public String describe() {
        return String.format("%dx%dx%d @ %.2fx%.2fx%.2fmm", nx, ny, nz, dx, dy, dz);
    }
}
