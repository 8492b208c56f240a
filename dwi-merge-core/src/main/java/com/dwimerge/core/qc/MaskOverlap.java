package com.dwimerge.core.qc;

import com.dwimerge.core.error.ValidationException;
import com.dwimerge.core.model.DwiImage;

/**
 * Dice overlap between two binary masks on the same grid.
 *
 * <p>A voxel belongs to a mask when its value is greater than zero.
 */
public final class MaskOverlap {

    private MaskOverlap() {
        // Utility class
    }

    /**
     * Computes {@code 2|A∩B| / (|A| + |B|)}.
     *
     * @param anatomicalMask mask from the anatomical pipeline
     * @param dwiMask brain mask of the merged DWI series
     * @return Dice coefficient in [0, 1]; 0 when both masks are empty
     * @throws ValidationException if the masks are not single volumes on a common grid
     */
    public static double dice(DwiImage anatomicalMask, DwiImage dwiMask) {
        if (anatomicalMask.volumeCount() != 1 || dwiMask.volumeCount() != 1) {
            throw new ValidationException("mask_overlap", "Masks must be single volumes, got "
                + anatomicalMask.volumeCount() + " and " + dwiMask.volumeCount());
        }
        if (!anatomicalMask.grid().matches(dwiMask.grid())) {
            throw new ValidationException("mask_overlap", "Mask grids differ: "
                + anatomicalMask.grid().describe() + " vs " + dwiMask.grid().describe());
        }
        float[] a = anatomicalMask.volume(0);
        float[] b = dwiMask.volume(0);
        long sizeA = 0;
        long sizeB = 0;
        long intersection = 0;
        for (int i = 0; i < a.length; i++) {
            boolean inA = a[i] > 0;
            boolean inB = b[i] > 0;
            if (inA) {
                sizeA++;
            }
            if (inB) {
                sizeB++;
            }
            if (inA && inB) {
                intersection++;
            }
        }
        if (sizeA + sizeB == 0) {
            return 0.0;
        }
        return 2.0 * intersection / (sizeA + sizeB);
    }
}
