package com.dwimerge.core.merge;

import com.dwimerge.core.error.ValidationException;
import com.dwimerge.core.model.AcquisitionGroup;
import com.dwimerge.core.model.AcquisitionGroupSet;
import com.dwimerge.core.util.VolumeMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes per-group intensity scale factors so that every group's mean b=0 signal
 * matches a common reference before concatenation.
 *
 * <p>factor = reference mean / group b=0 mean, applied to every volume of the group.
 * The reference is either supplied externally or taken from the first group.
 */
public final class B0IntensityHarmonizer {

    private static final Logger log = LoggerFactory.getLogger(B0IntensityHarmonizer.class);

    private final MergeContext context;

    public B0IntensityHarmonizer(MergeContext context) {
        this.context = context;
    }

    /**
     * Mean b=0 intensity of one group: all voxels of its b=0 volumes, or of its
     * b=0 reference when the series contains no b=0 volume.
     *
     * @param group acquisition group
     * @return mean intensity
     * @throws ValidationException if the mean is not positive
     */
    public double b0Mean(AcquisitionGroup group) {
        List<float[]> b0Volumes = new ArrayList<>();
        for (int i = 0; i < group.volumeCount(); i++) {
            if (context.isB0(group.bvals().get(i))) {
                b0Volumes.add(group.image().volume(i));
            }
        }
        if (b0Volumes.isEmpty()) {
            log.debug("Group {} has no b=0 volume, using its b=0 reference for harmonization", group.id());
            b0Volumes.add(group.b0Reference().volume(0));
        }
        double mean = VolumeMath.grandMean(b0Volumes);
        if (!(mean > 0)) {
            throw new ValidationException(group.id(), "Mean b=0 intensity is " + mean
                + "; cannot harmonize b=0 intensities");
        }
        return mean;
    }

    /**
     * Scale factor per group, in group order.
     *
     * @param groups acquisition groups
     * @return factors, 1.0 for the reference group
     */
    public List<Double> scaleFactors(AcquisitionGroupSet groups) {
        List<Double> means = groups.groups().stream().map(this::b0Mean).toList();
        double reference = context.b0IntensityReference() != null
            ? context.b0IntensityReference()
            : means.get(0);
        List<Double> factors = new ArrayList<>(means.size());
        for (int i = 0; i < means.size(); i++) {
            double factor = reference / means.get(i);
            factors.add(factor);
            log.debug("Group {}: b=0 mean {} -> scale factor {}", groups.get(i).id(),
                String.format("%.3f", means.get(i)), String.format("%.4f", factor));
        }
        return factors;
    }
}
