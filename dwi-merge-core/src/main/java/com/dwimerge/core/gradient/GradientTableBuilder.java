package com.dwimerge.core.gradient;

import com.dwimerge.core.error.FormatException;
import com.dwimerge.core.model.GradientTable;
import com.dwimerge.core.model.MergedDataset;
import com.dwimerge.core.model.Vector3;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives a normalized {@link GradientTable} from b-values and b-vectors.
 *
 * <p>Directions are normalized to unit length. When a diffusion-weighted vector is not
 * of unit length and b-value scaling is enabled, the b-value is scaled by the squared
 * norm, matching the MRtrix convention for encodings with several b-values stored
 * through vector length. Zero vectors are only legal for b=0 volumes.
 */
public class GradientTableBuilder {

    private static final double UNIT_TOLERANCE = 0.01;

    private final double b0Threshold;
    private final boolean scaleBValues;

    /**
     * Creates a builder.
     *
     * @param b0Threshold b-values at or below this are treated as b=0
     * @param scaleBValues scale b by |v|² for non-unit vectors
     */
    public GradientTableBuilder(double b0Threshold, boolean scaleBValues) {
        this.b0Threshold = b0Threshold;
        this.scaleBValues = scaleBValues;
    }

    /**
     * Builds the table.
     *
     * @param bvals one b-value per volume
     * @param bvecs one b-vector per volume
     * @return gradient table with one row per volume
     * @throws FormatException if the inputs are empty, of different lengths, non-finite,
     *     negative, or a diffusion-weighted volume has no direction
     */
    public GradientTable build(List<Double> bvals, List<Vector3> bvecs) {
        if (bvals == null || bvecs == null) {
            throw new FormatException("gradient_table", "b-values and b-vectors are required");
        }
        if (bvals.size() != bvecs.size()) {
            throw new FormatException("gradient_table", "Got " + bvals.size() + " b-values but "
                + bvecs.size() + " b-vectors");
        }
        if (bvals.isEmpty()) {
            throw new FormatException("gradient_table", "Gradient table is empty");
        }

        List<GradientTable.Row> rows = new ArrayList<>(bvals.size());
        for (int i = 0; i < bvals.size(); i++) {
            Double b = bvals.get(i);
            Vector3 v = bvecs.get(i);
            if (b == null || v == null || !Double.isFinite(b)) {
                throw new FormatException("gradient_table", "Row " + i + " is missing or not finite");
            }
            if (b < 0) {
                throw new FormatException("gradient_table", "Row " + i + " has negative b-value " + b);
            }
            double norm = v.norm();
            if (b <= b0Threshold && norm < 1e-6) {
                rows.add(new GradientTable.Row(Vector3.ZERO, b));
                continue;
            }
            if (norm < 1e-6) {
                throw new FormatException("gradient_table", "Row " + i + " has b=" + b + " but a zero b-vector");
            }
            double effectiveB = b;
            if (scaleBValues && Math.abs(norm - 1.0) > UNIT_TOLERANCE && b > b0Threshold) {
                effectiveB = b * norm * norm;
            }
            rows.add(new GradientTable.Row(v.normalized(), effectiveB));
        }
        return new GradientTable(rows);
    }

    /**
     * Builds the table of a merged dataset.
     *
     * @param dataset merged dataset
     * @return gradient table with one row per merged volume
     */
    public GradientTable build(MergedDataset dataset) {
        return build(dataset.bvals(), dataset.bvecs());
    }
}
