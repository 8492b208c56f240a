package com.dwimerge.core.util;

import java.util.List;

/**
 * Voxelwise arithmetic on flat volume arrays.
 */
public final class VolumeMath {

    private VolumeMath() {
        // Utility class
    }

    /**
     * Voxelwise mean of equally sized volumes.
     *
     * @param volumes volumes to average, at least one
     * @return new array holding the mean
     */
    public static float[] mean(List<float[]> volumes) {
        if (volumes.isEmpty()) {
            throw new IllegalArgumentException("At least one volume required");
        }
        int length = volumes.get(0).length;
        double[] sum = new double[length];
        for (float[] volume : volumes) {
            if (volume.length != length) {
                throw new IllegalArgumentException("Volume lengths differ: " + volume.length + " vs " + length);
            }
            for (int i = 0; i < length; i++) {
                sum[i] += volume[i];
            }
        }
        float[] result = new float[length];
        for (int i = 0; i < length; i++) {
            result[i] = (float) (sum[i] / volumes.size());
        }
        return result;
    }

    /**
     * Multiplies every voxel by a constant.
     *
     * @param volume input volume
     * @param factor scale factor
     * @return new scaled array
     */
    public static float[] scale(float[] volume, double factor) {
        float[] result = new float[volume.length];
        for (int i = 0; i < volume.length; i++) {
            result[i] = (float) (volume[i] * factor);
        }
        return result;
    }

    /**
     * Mean intensity over all voxels of all given volumes.
     *
     * @param volumes volumes
     * @return grand mean, or 0 for no voxels
     */
    public static double grandMean(List<float[]> volumes) {
        double sum = 0.0;
        long count = 0;
        for (float[] volume : volumes) {
            for (float value : volume) {
                sum += value;
            }
            count += volume.length;
        }
        return count == 0 ? 0.0 : sum / count;
    }

    /**
     * Pearson correlation of two volumes restricted to a mask.
     *
     * @param a first volume
     * @param b second volume
     * @param mask voxels to include, or {@code null} for all voxels
     * @return correlation coefficient, or {@link Double#NaN} if either volume is constant in the mask
     */
    public static double correlation(float[] a, float[] b, boolean[] mask) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Volume lengths differ: " + a.length + " vs " + b.length);
        }
        double sumA = 0;
        double sumB = 0;
        int n = 0;
        for (int i = 0; i < a.length; i++) {
            if (mask == null || mask[i]) {
                sumA += a[i];
                sumB += b[i];
                n++;
            }
        }
        if (n < 2) {
            return Double.NaN;
        }
        double meanA = sumA / n;
        double meanB = sumB / n;
        double cov = 0;
        double varA = 0;
        double varB = 0;
        for (int i = 0; i < a.length; i++) {
            if (mask == null || mask[i]) {
                double da = a[i] - meanA;
                double db = b[i] - meanB;
                cov += da * db;
                varA += da * da;
                varB += db * db;
            }
        }
        if (varA == 0 || varB == 0) {
            return Double.NaN;
        }
        return cov / Math.sqrt(varA * varB);
    }
}
