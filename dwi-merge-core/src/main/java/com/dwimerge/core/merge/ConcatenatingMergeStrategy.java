package com.dwimerge.core.merge;

import com.dwimerge.core.model.AcquisitionGroup;
import com.dwimerge.core.model.AcquisitionGroupSet;
import com.dwimerge.core.model.DwiImage;
import com.dwimerge.core.model.MergedDataset;
import com.dwimerge.core.model.Vector3;
import com.dwimerge.core.model.VolumeProvenance;
import com.dwimerge.core.util.VolumeMath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Concatenates all groups along the diffusion axis.
 *
 * <p>Volumes, b-values and b-vectors keep group order, then within-group order. With
 * {@link MergeContext#harmonizeB0Intensities()} every group is first rescaled by
 * {@link B0IntensityHarmonizer} so that inter-group intensity offsets do not bias
 * model fitting downstream. All groups must share one spatial grid.
 */
public class ConcatenatingMergeStrategy extends AbstractMergeStrategy {

    @Override
    public MergeStrategyType getType() {
        return MergeStrategyType.CONCATENATE;
    }

    @Override
    public String getDisplayName() {
        return "Volume Concatenation";
    }

    @Override
    public MergedDataset merge(AcquisitionGroupSet groups, MergeContext context) {
        requireCommonGrid(groups.ids(), groups.images(), "Image");

        List<Double> factors = context.harmonizeB0Intensities()
            ? new B0IntensityHarmonizer(context).scaleFactors(groups)
            : Collections.nCopies(groups.size(), 1.0);

        List<float[]> volumes = new ArrayList<>(groups.totalVolumeCount());
        List<Double> bvals = new ArrayList<>(groups.totalVolumeCount());
        List<Vector3> bvecs = new ArrayList<>(groups.totalVolumeCount());
        List<VolumeProvenance> provenance = new ArrayList<>(groups.totalVolumeCount());

        for (int g = 0; g < groups.size(); g++) {
            AcquisitionGroup group = groups.get(g);
            double factor = factors.get(g);
            for (int v = 0; v < group.volumeCount(); v++) {
                float[] volume = group.image().volume(v);
                volumes.add(factor == 1.0 ? volume : VolumeMath.scale(volume, factor));
                bvals.add(group.bvals().get(v));
                bvecs.add(group.bvecs().get(v));
                provenance.add(VolumeProvenance.single(group.id(), v));
            }
            log.debug("Appended {} volumes of group {}", group.volumeCount(), group.id());
        }

        DwiImage merged = new DwiImage(groups.get(0).image().grid(), volumes);
        log.info("Concatenated {} groups into {} volumes{}", groups.size(), merged.volumeCount(),
            context.harmonizeB0Intensities() ? " (b=0 intensities harmonized)" : "");

        return new MergedDataset(getId(), merged, bvals, bvecs, provenance, groups.ids(),
            concatenateRaw(groups), meanB0Reference(groups));
    }
}
