package com.dwimerge.core.denoise;

import com.dwimerge.core.error.ValidationException;
import com.dwimerge.core.model.AcquisitionGroup;
import com.dwimerge.core.model.DwiImage;
import com.dwimerge.core.model.MergedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Optional denoising around the merge.
 *
 * <p>With a window of 0 the stage is inactive and callers leave it out of the graph.
 * Otherwise it denoises either each group before merging ({@link #denoiseGroup}) or the
 * merged series once ({@link #denoiseMerged}), and reports the matching noise map.
 */
public class DenoiseStage {

    private static final Logger log = LoggerFactory.getLogger(DenoiseStage.class);

    private final DenoiseSettings settings;
    private final Denoiser denoiser;

    public DenoiseStage(DenoiseSettings settings, Denoiser denoiser) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.denoiser = Objects.requireNonNull(denoiser, "denoiser must not be null");
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    public boolean runsBeforeMerge() {
        return settings.isEnabled() && settings.beforeMerge();
    }

    public boolean runsAfterMerge() {
        return settings.isEnabled() && !settings.beforeMerge();
    }

    public DenoiseSettings settings() {
        return settings;
    }

    /**
     * Denoises one group's corrected series.
     *
     * @param group acquisition group
     * @return denoised series and the group's noise map
     */
    public DenoiseResult denoiseGroup(AcquisitionGroup group) {
        requireEnabled();
        log.debug("Denoising group {} ({} volumes, window {})", group.id(), group.volumeCount(), settings.window());
        return checked(group.image(), denoiser.denoise(group.image(), settings, group.id()), group.id());
    }

    /**
     * Denoises the merged series.
     *
     * @param dataset merged dataset
     * @return denoised series and the noise map of the merged series
     */
    public DenoiseResult denoiseMerged(MergedDataset dataset) {
        requireEnabled();
        log.debug("Denoising merged series ({} volumes, window {})", dataset.volumeCount(), settings.window());
        return checked(dataset.image(), denoiser.denoise(dataset.image(), settings, "merged"), "merged");
    }

    private void requireEnabled() {
        if (!settings.isEnabled()) {
            throw new IllegalStateException("Denoising is disabled (window 0)");
        }
    }

    private DenoiseResult checked(DwiImage input, DenoiseResult result, String label) {
        DwiImage output = result.denoised();
        if (output.volumeCount() != input.volumeCount() || !output.grid().matches(input.grid())) {
            throw new ValidationException(label, String.format(
                "%s returned %d volumes on %s for an input of %d volumes on %s",
                denoiser.getId(), output.volumeCount(), output.grid().describe(),
                input.volumeCount(), input.grid().describe()));
        }
        return result;
    }
}
