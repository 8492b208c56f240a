package com.dwimerge.core.merge;

import com.dwimerge.core.model.Vector3;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pairs volumes from different groups that sampled the same q-space coordinate.
 *
 * <p>Two volumes match when
 * <ul>
 *   <li>both b-values are at or below the b=0 threshold (any b=0 pairs with any b=0), or</li>
 *   <li>their b-values differ by at most {@link QSpaceTolerance#bValueTolerance()} and the
 *       angle between their original directions is within
 *       {@link QSpaceTolerance#directionToleranceDegrees()}, ignoring sign when
 *       {@link QSpaceTolerance#antipodalMatching()} is set.</li>
 * </ul>
 *
 * <p>Pairing walks the volumes in concatenated order. Each volume looks back for the
 * closest still-unpaired, matching volume of another group; earlier candidates win ties.
 * A volume is paired at most once.
 */
public class QSpaceMatcher {

    private final MergeContext context;

    public QSpaceMatcher(MergeContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    /**
     * One volume as seen by the matcher.
     *
     * @param group group index in merge order
     * @param volume volume index within the group
     * @param bValue b-value
     * @param direction original (pre motion correction) direction
     * @param matchable false for volumes of groups without usable original b-vectors
     */
    public record Candidate(int group, int volume, double bValue, Vector3 direction, boolean matchable) {
    }

    /**
     * A matched pair, as indices into the candidate list.
     *
     * @param anchor earlier candidate
     * @param partner later candidate
     */
    public record Pair(int anchor, int partner) {
    }

    /**
     * Returns the match distance between two volumes, or {@link Double#NaN} if they do
     * not sample the same q-space coordinate. b=0 pairs have distance 0; otherwise the
     * distance is {@code 1 - cos} of the (antipodally folded) angle.
     *
     * @param bA b-value of the first volume
     * @param vA direction of the first volume
     * @param bB b-value of the second volume
     * @param vB direction of the second volume
     * @return distance in [0, 1], or NaN
     */
    public double distance(double bA, Vector3 vA, double bB, Vector3 vB) {
        boolean b0A = context.isB0(bA);
        boolean b0B = context.isB0(bB);
        if (b0A && b0B) {
            return 0.0;
        }
        if (b0A || b0B) {
            return Double.NaN;
        }
        QSpaceTolerance tolerance = context.tolerance();
        if (Math.abs(bA - bB) > tolerance.bValueTolerance()) {
            return Double.NaN;
        }
        Vector3 uA = vA.normalized();
        Vector3 uB = vB.normalized();
        if (uA.isZero(1e-9) || uB.isZero(1e-9)) {
            return Double.NaN;
        }
        double cosine = uA.dot(uB);
        if (tolerance.antipodalMatching()) {
            cosine = Math.abs(cosine);
        }
        if (cosine < tolerance.minimumCosine() - 1e-12) {
            return Double.NaN;
        }
        return 1.0 - Math.min(1.0, cosine);
    }

    public boolean matches(double bA, Vector3 vA, double bB, Vector3 vB) {
        return !Double.isNaN(distance(bA, vA, bB, vB));
    }

    /**
     * Greedily pairs candidates of different groups.
     *
     * <p>Candidates are visited in concatenated order. Each one takes the closest earlier
     * unpaired candidate of another group and keeps it. Pairs are never revisited, so when
     * several directions of one group lie within tolerance of each other the result may
     * pair fewer volumes than the largest possible assignment. Acquisition schemes space
     * their directions far wider than the angular tolerance.
     *
     * @param candidates all volumes in concatenated order
     * @return pairs in the order they were formed
     */
    public List<Pair> findPairs(List<Candidate> candidates) {
        boolean[] paired = new boolean[candidates.size()];
        List<Pair> pairs = new ArrayList<>();
        for (int j = 0; j < candidates.size(); j++) {
            Candidate current = candidates.get(j);
            if (!current.matchable()) {
                continue;
            }
            int best = -1;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int i = 0; i < j; i++) {
                Candidate earlier = candidates.get(i);
                if (paired[i] || !earlier.matchable() || earlier.group() == current.group()) {
                    continue;
                }
                double d = distance(earlier.bValue(), earlier.direction(), current.bValue(), current.direction());
                if (!Double.isNaN(d) && d < bestDistance) {
                    best = i;
                    bestDistance = d;
                }
            }
            if (best >= 0) {
                paired[best] = true;
                paired[j] = true;
                pairs.add(new Pair(best, j));
            }
        }
        return pairs;
    }
}
