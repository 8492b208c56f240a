package com.dwimerge.core.merge;

import com.dwimerge.core.error.ValidationException;
import com.dwimerge.core.model.AcquisitionGroupSet;
import com.dwimerge.core.model.DwiImage;
import com.dwimerge.core.util.VolumeMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for merge strategies providing the steps both algorithms share.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per strategy class)</li>
 *   <li>Spatial grid checks across groups ({@link #requireCommonGrid(List, List, String)})</li>
 *   <li>Concatenation of the raw QC inputs ({@link #concatenateRaw(AcquisitionGroupSet)})</li>
 *   <li>The merged b=0 reference ({@link #meanB0Reference(AcquisitionGroupSet)})</li>
 * </ul>
 */
public abstract class AbstractMergeStrategy implements MergeStrategy {

    /**
     * Logger instance for this strategy.
     * Automatically initialized with the concrete strategy class name.
     */
    protected final Logger log;

    protected AbstractMergeStrategy() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Fails unless every image shares the grid of the first one.
     *
     * @param ids group identifiers, parallel to {@code images}
     * @param images images to check
     * @param artifact artifact name used in the error message
     * @throws ValidationException naming the first group whose grid differs
     */
    protected void requireCommonGrid(List<String> ids, List<DwiImage> images, String artifact) {
        DwiImage reference = images.get(0);
        for (int i = 1; i < images.size(); i++) {
            if (!images.get(i).grid().matches(reference.grid())) {
                throw new ValidationException(ids.get(i), String.format(
                    "%s grid %s differs from %s of group '%s'; groups must share one spatial grid",
                    artifact, images.get(i).grid().describe(), reference.grid().describe(), ids.get(0)));
            }
        }
    }

    /**
     * Concatenates images along the volume axis in list order.
     *
     * @param images images on a common grid
     * @return concatenated image
     */
    protected DwiImage concatenate(List<DwiImage> images) {
        List<float[]> volumes = new ArrayList<>();
        images.forEach(image -> volumes.addAll(image.volumes()));
        return new DwiImage(images.get(0).grid(), volumes);
    }

    /**
     * Concatenates the raw inputs of every group for the post-merge QC.
     *
     * @param groups acquisition groups
     * @return raw series in group order
     */
    protected DwiImage concatenateRaw(AcquisitionGroupSet groups) {
        requireCommonGrid(groups.ids(), groups.rawConcatenatedImages(), "Raw concatenated image");
        return concatenate(groups.rawConcatenatedImages());
    }

    /**
     * Averages the b=0 references of all groups voxelwise.
     *
     * @param groups acquisition groups on a common grid
     * @return single-volume merged reference
     */
    protected DwiImage meanB0Reference(AcquisitionGroupSet groups) {
        List<float[]> references = groups.b0References().stream().map(ref -> ref.volume(0)).toList();
        return DwiImage.single(groups.get(0).b0Reference().grid(), VolumeMath.mean(references));
    }
}
