package com.dwimerge.core.qc;

import com.dwimerge.core.error.ValidationException;
import com.dwimerge.core.model.DwiImage;
import com.dwimerge.core.model.GradientTable;
import com.dwimerge.core.model.QcMetrics;
import com.dwimerge.core.model.SpatialGrid;
import com.dwimerge.core.model.Vector3;
import com.dwimerge.core.util.VolumeMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes image quality metrics of a DWI series and its gradient scheme.
 *
 * <p>Metrics, in output order:
 * <ul>
 *   <li>{@code dimension_x/y/z} and {@code voxel_size_x/y/z}: grid geometry</li>
 *   <li>{@code num_volumes}, {@code num_b0}, {@code max_b}: scheme summary</li>
 *   <li>{@code num_directions}: distinct diffusion-weighted directions (antipodes are one direction)</li>
 *   <li>{@code neighbor_corr}: mean correlation of each diffusion-weighted volume with the volume
 *       closest to it in q-space, within the voxels where the mean b=0 signal is positive</li>
 * </ul>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * QcMetrics metrics = new ImageQcCalculator(100).compute(image, bvals, bvecs).prefixed("t1_");
 * }</pre>
 */
public class ImageQcCalculator {

    private static final Logger log = LoggerFactory.getLogger(ImageQcCalculator.class);

    private static final double SAME_DIRECTION_COSINE = Math.cos(Math.toRadians(1.0));

    private final double b0Threshold;

    public ImageQcCalculator(double b0Threshold) {
        this.b0Threshold = b0Threshold;
    }

    /**
     * Computes the metrics of one series.
     *
     * @param image DWI series
     * @param bvals one b-value per volume
     * @param bvecs one b-vector per volume
     * @return unprefixed metrics
     * @throws ValidationException if the gradient tables do not match the image
     */
    public QcMetrics compute(DwiImage image, List<Double> bvals, List<Vector3> bvecs) {
        if (bvals.size() != image.volumeCount() || bvecs.size() != image.volumeCount()) {
            throw new ValidationException("qc", String.format(
                "Cannot compute QC: %d volumes, %d bvals, %d bvecs",
                image.volumeCount(), bvals.size(), bvecs.size()));
        }
        SpatialGrid grid = image.grid();
        List<Integer> b0Volumes = new ArrayList<>();
        List<Integer> weighted = new ArrayList<>();
        for (int i = 0; i < bvals.size(); i++) {
            if (bvals.get(i) <= b0Threshold) {
                b0Volumes.add(i);
            } else {
                weighted.add(i);
            }
        }

        Map<String, Double> values = new LinkedHashMap<>();
        values.put("dimension_x", (double) grid.nx());
        values.put("dimension_y", (double) grid.ny());
        values.put("dimension_z", (double) grid.nz());
        values.put("voxel_size_x", grid.dx());
        values.put("voxel_size_y", grid.dy());
        values.put("voxel_size_z", grid.dz());
        values.put("num_volumes", (double) image.volumeCount());
        values.put("num_b0", (double) b0Volumes.size());
        values.put("max_b", bvals.stream().mapToDouble(Double::doubleValue).max().orElse(0.0));
        values.put("num_directions", (double) countDirections(weighted, bvecs));
        values.put("neighbor_corr", neighborCorrelation(image, weighted, b0Volumes, bvals, bvecs));
        return new QcMetrics(values);
    }

    private int countDirections(List<Integer> weighted, List<Vector3> bvecs) {
        List<Vector3> distinct = new ArrayList<>();
        for (int index : weighted) {
            Vector3 direction = bvecs.get(index).normalized();
            if (direction.isZero(1e-6)) {
                continue;
            }
            boolean seen = distinct.stream()
                .anyMatch(known -> Math.abs(known.dot(direction)) >= SAME_DIRECTION_COSINE);
            if (!seen) {
                distinct.add(direction);
            }
        }
        return distinct.size();
    }

    private double neighborCorrelation(DwiImage image, List<Integer> weighted, List<Integer> b0Volumes,
                                       List<Double> bvals, List<Vector3> bvecs) {
        if (weighted.size() < 2) {
            return Double.NaN;
        }
        boolean[] mask = signalMask(image, b0Volumes.isEmpty() ? weighted : b0Volumes);
        double sum = 0.0;
        int counted = 0;
        for (int index : weighted) {
            int neighbor = closestInShell(index, weighted, bvals, bvecs);
            if (neighbor < 0) {
                continue;
            }
            double r = VolumeMath.correlation(image.volume(index), image.volume(neighbor), mask);
            if (Double.isFinite(r)) {
                sum += r;
                counted++;
            }
        }
        if (counted == 0) {
            log.debug("No finite neighbor correlation over {} weighted volumes", weighted.size());
            return Double.NaN;
        }
        return sum / counted;
    }

    private int closestInShell(int index, List<Integer> weighted, List<Double> bvals, List<Vector3> bvecs) {
        Vector3 direction = bvecs.get(index).normalized();
        int best = -1;
        double bestCosine = -1.0;
        for (int other : weighted) {
            if (other == index || Math.abs(bvals.get(other) - bvals.get(index)) > GradientTable.SHELL_WIDTH) {
                continue;
            }
            double cosine = Math.abs(direction.dot(bvecs.get(other).normalized()));
            if (cosine > bestCosine) {
                bestCosine = cosine;
                best = other;
            }
        }
        return best;
    }

    private boolean[] signalMask(DwiImage image, List<Integer> volumes) {
        float[] mean = VolumeMath.mean(image.select(volumes).volumes());
        boolean[] mask = new boolean[mean.length];
        for (int i = 0; i < mean.length; i++) {
            mask[i] = mean[i] > 0;
        }
        return mask;
    }
}
