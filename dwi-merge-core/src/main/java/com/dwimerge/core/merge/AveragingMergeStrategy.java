package com.dwimerge.core.merge;

import com.dwimerge.core.error.ValidationException;
import com.dwimerge.core.model.AcquisitionGroup;
import com.dwimerge.core.model.AcquisitionGroupSet;
import com.dwimerge.core.model.DwiImage;
import com.dwimerge.core.model.MergedDataset;
import com.dwimerge.core.model.Vector3;
import com.dwimerge.core.model.VolumeProvenance;
import com.dwimerge.core.model.VolumeSource;
import com.dwimerge.core.util.VolumeMath;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Averages volumes that sampled the same q-space coordinate in different groups,
 * typically the two halves of a reverse phase-encoding acquisition.
 *
 * <p>Matching uses the b-values and the <em>original</em> b-vectors: motion correction may
 * have rotated the final b-vectors per volume, so they are unsuitable for deciding identity.
 * Matched volumes are averaged voxelwise in their final image space; their b-value is the
 * pair mean and their b-vector the sign-aligned mean of the final b-vectors. Unmatched
 * volumes pass through unchanged.
 *
 * <p>Output volumes are ordered by the position of their first source in concatenated order.
 */
public class AveragingMergeStrategy extends AbstractMergeStrategy {

    @Override
    public MergeStrategyType getType() {
        return MergeStrategyType.AVERAGE;
    }

    @Override
    public String getDisplayName() {
        return "Q-space Pair Averaging";
    }

    @Override
    public MergedDataset merge(AcquisitionGroupSet groups, MergeContext context) {
        if (groups.size() < 2) {
            throw new ValidationException("groups", "Averaging requires at least two acquisition groups, got "
                + groups.size());
        }
        requireCommonGrid(groups.ids(), groups.images(), "Image");

        List<QSpaceMatcher.Candidate> candidates = collectCandidates(groups, context);
        List<QSpaceMatcher.Pair> pairs = new QSpaceMatcher(context).findPairs(candidates);

        int[] partnerOf = new int[candidates.size()];
        Arrays.fill(partnerOf, -1);
        boolean[] isPartner = new boolean[candidates.size()];
        for (QSpaceMatcher.Pair pair : pairs) {
            partnerOf[pair.anchor()] = pair.partner();
            isPartner[pair.partner()] = true;
        }

        int outputCount = candidates.size() - pairs.size();
        List<float[]> volumes = new ArrayList<>(outputCount);
        List<Double> bvals = new ArrayList<>(outputCount);
        List<Vector3> bvecs = new ArrayList<>(outputCount);
        List<VolumeProvenance> provenance = new ArrayList<>(outputCount);

        for (int k = 0; k < candidates.size(); k++) {
            if (isPartner[k]) {
                continue;
            }
            QSpaceMatcher.Candidate anchor = candidates.get(k);
            AcquisitionGroup anchorGroup = groups.get(anchor.group());
            float[] anchorVolume = anchorGroup.image().volume(anchor.volume());
            double anchorB = anchorGroup.bvals().get(anchor.volume());
            Vector3 anchorVec = anchorGroup.bvecs().get(anchor.volume());
            VolumeSource anchorSource = new VolumeSource(anchorGroup.id(), anchor.volume());

            if (partnerOf[k] < 0) {
                volumes.add(anchorVolume);
                bvals.add(anchorB);
                bvecs.add(anchorVec);
                provenance.add(new VolumeProvenance(List.of(anchorSource)));
                continue;
            }

            QSpaceMatcher.Candidate partner = candidates.get(partnerOf[k]);
            AcquisitionGroup partnerGroup = groups.get(partner.group());
            float[] partnerVolume = partnerGroup.image().volume(partner.volume());
            double partnerB = partnerGroup.bvals().get(partner.volume());
            Vector3 partnerVec = partnerGroup.bvecs().get(partner.volume());

            volumes.add(VolumeMath.mean(List.of(anchorVolume, partnerVolume)));
            bvals.add((anchorB + partnerB) / 2.0);
            bvecs.add(averageDirection(anchorVec, partnerVec));
            provenance.add(VolumeProvenance.pair(anchorSource, new VolumeSource(partnerGroup.id(), partner.volume())));
            log.debug("Averaged {} with {}", anchorSource, provenance.get(provenance.size() - 1).sources().get(1));
        }

        DwiImage merged = new DwiImage(groups.get(0).image().grid(), volumes);
        log.info("Averaged {} q-space pairs across {} groups; {} unpaired volumes kept; {} volumes total",
            pairs.size(), groups.size(), merged.volumeCount() - pairs.size(), merged.volumeCount());

        return new MergedDataset(getId(), merged, bvals, bvecs, provenance, groups.ids(),
            concatenateRaw(groups), meanB0Reference(groups));
    }

    /**
     * Builds the matcher input, marking groups without usable original b-vectors as unmatchable.
     */
    private List<QSpaceMatcher.Candidate> collectCandidates(AcquisitionGroupSet groups, MergeContext context) {
        List<QSpaceMatcher.Candidate> candidates = new ArrayList<>(groups.totalVolumeCount());
        int usableGroups = 0;
        for (int g = 0; g < groups.size(); g++) {
            AcquisitionGroup group = groups.get(g);
            boolean usable = hasUsableOriginalBvecs(group, context);
            if (usable) {
                usableGroups++;
            } else {
                log.warn("Group {} has no usable original b-vectors ({} rows for {} volumes); its volumes will not be paired",
                    group.id(), group.originalBvecs().size(), group.volumeCount());
            }
            for (int v = 0; v < group.volumeCount(); v++) {
                Vector3 direction = usable ? group.originalBvecs().get(v) : Vector3.ZERO;
                candidates.add(new QSpaceMatcher.Candidate(g, v, group.bvals().get(v), direction, usable));
            }
        }
        if (usableGroups == 0) {
            throw new ValidationException("original_bvec",
                "No acquisition group provides usable original b-vectors; cannot match q-space pairs");
        }
        return candidates;
    }

    /**
     * Usable means one row per volume and a non-zero direction for every diffusion-weighted volume.
     */
    static boolean hasUsableOriginalBvecs(AcquisitionGroup group, MergeContext context) {
        List<Vector3> original = group.originalBvecs();
        if (original.size() != group.volumeCount()) {
            return false;
        }
        for (int v = 0; v < original.size(); v++) {
            if (!context.isB0(group.bvals().get(v)) && original.get(v).isZero(1e-6)) {
                return false;
            }
        }
        return true;
    }

    private static Vector3 averageDirection(Vector3 a, Vector3 b) {
        Vector3 aligned = a.dot(b) < 0 ? b.negate() : b;
        return a.plus(aligned).normalized();
    }
}
