package com.dwimerge.core.config;

import com.dwimerge.core.model.ArtifactSlot;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration of a merge run.
 *
 * <p>Loaded from {@code dwimerge.yaml}. Paths are resolved against the directory holding
 * the file. Absent sections fall back to the defaults documented on each accessor; values
 * that are present are checked by {@link MergeConfigValidator}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * merging:
 *   strategy: average
 *   b0Threshold: 100
 *
 * denoise:
 *   window: 5
 *   beforeCombining: true
 *
 * output:
 *   directory: ./derivatives
 *   prefix: sub-01_dwi
 *
 * qc:
 *   anatomicalMask: anat/brain_mask.nii.gz
 *   dwiMask: dwi/brain_mask_t1.nii.gz
 *
 * groups:
 *   - id: dir-AP
 *     image: ap/dwi.nii.gz
 *     bval: ap/dwi.bval
 *     bvec: ap/dwi.bvec
 *     originalBvec: ap/orig.bvec
 *     originalImage: ap/orig.nii.gz
 *     rawConcatenatedImage: ap/raw.nii.gz
 *     b0Ref: ap/b0.nii.gz
 * }</pre>
 *
 * @param merging merge strategy settings
 * @param denoise denoising settings
 * @param combineAllDwis whether upstream combined every DWI series of the session
 * @param threads worker threads of the graph runner
 * @param output output settings
 * @param qc quality-control inputs
 * @param passThrough output name to path of artifacts copied verbatim to the derivatives
 * @param groups acquisition groups in merge order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MergeConfig(
    @JsonProperty("merging") MergingConfig merging,
    @JsonProperty("denoise") DenoiseConfig denoise,
    @JsonProperty("combineAllDwis") Boolean combineAllDwis,
    @JsonProperty("threads") Integer threads,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("qc") QcConfig qc,
    @JsonProperty("passThrough") Map<String, String> passThrough,
    @JsonProperty("groups") List<GroupConfig> groups
) {
    public MergingConfig mergingOrDefaults() {
        return merging != null ? merging : new MergingConfig(null, null, null, null, null, null, null);
    }

    public DenoiseConfig denoiseOrDefaults() {
        return denoise != null ? denoise : new DenoiseConfig(null, null);
    }

    public boolean combineAllDwisOrDefault() {
        return combineAllDwis == null || combineAllDwis;
    }

    public int threadsOrDefault() {
        return threads != null ? threads : 1;
    }

    public OutputConfig outputOrDefaults() {
        return output != null ? output : new OutputConfig(null, null, null, null);
    }

    public QcConfig qcOrDefaults() {
        return qc != null ? qc : new QcConfig(null, null, null, null);
    }

    public Map<String, String> passThroughOrEmpty() {
        return passThrough != null ? passThrough : Map.of();
    }

    public List<GroupConfig> groupsOrEmpty() {
        return groups != null ? groups : List.of();
    }

    /**
     * Returns a copy with the given overrides applied; {@code null} keeps the current value.
     *
     * @param strategy merge strategy selector
     * @param outputDirectory derivatives directory
     * @param threadCount worker threads
     * @return overridden configuration
     */
    public MergeConfig withOverrides(String strategy, String outputDirectory, Integer threadCount) {
        MergingConfig m = mergingOrDefaults();
        MergingConfig newMerging = strategy == null ? merging : new MergingConfig(strategy,
            m.harmonizeB0Intensities(), m.b0Threshold(), m.b0IntensityReference(),
            m.bValueTolerance(), m.directionToleranceDegrees(), m.antipodalMatching());
        OutputConfig o = outputOrDefaults();
        OutputConfig newOutput = outputDirectory == null ? output
            : new OutputConfig(outputDirectory, o.reportletsDirectory(), o.prefix(), o.sourceFile());
        return new MergeConfig(newMerging, denoise, combineAllDwis,
            threadCount == null ? threads : threadCount, newOutput, qc, passThrough, groups);
    }

    /**
     * Merge strategy settings.
     *
     * @param strategy {@code average} or any value starting with {@code concat} (default {@code average})
     * @param harmonizeB0Intensities scale groups to a common b=0 mean before concatenating (default true)
     * @param b0Threshold largest b-value treated as b=0 (default 100)
     * @param b0IntensityReference external b=0 mean to harmonize to (default: first group)
     * @param bValueTolerance largest b-value difference of a matched pair (default 50)
     * @param directionToleranceDegrees largest angle of a matched pair (default 5)
     * @param antipodalMatching whether v and -v sample the same point (default true)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MergingConfig(
        @JsonProperty("strategy") String strategy,
        @JsonProperty("harmonizeB0Intensities") Boolean harmonizeB0Intensities,
        @JsonProperty("b0Threshold") Double b0Threshold,
        @JsonProperty("b0IntensityReference") Double b0IntensityReference,
        @JsonProperty("bValueTolerance") Double bValueTolerance,
        @JsonProperty("directionToleranceDegrees") Double directionToleranceDegrees,
        @JsonProperty("antipodalMatching") Boolean antipodalMatching
    ) {}

    /**
     * Denoising settings.
     *
     * @param window cubic patch extent, 0 disables denoising (default 0)
     * @param beforeCombining denoise each group before merging (default false)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DenoiseConfig(
        @JsonProperty("window") Integer window,
        @JsonProperty("beforeCombining") Boolean beforeCombining
    ) {}

    /**
     * Output settings.
     *
     * @param directory derivatives directory (default {@code ./derivatives})
     * @param reportletsDirectory report directory (default {@code <directory>/reportlets})
     * @param prefix output file prefix (default {@code dwi})
     * @param sourceFile identifier the derivatives are keyed by
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("reportletsDirectory") String reportletsDirectory,
        @JsonProperty("prefix") String prefix,
        @JsonProperty("sourceFile") String sourceFile
    ) {
        public String directoryOrDefault() {
            return directory != null ? directory : "./derivatives";
        }

        public String prefixOrDefault() {
            return prefix != null ? prefix : "dwi";
        }
    }

    /**
     * Quality-control inputs.
     *
     * @param anatomicalMask anatomical brain mask on the output grid
     * @param dwiMask DWI brain mask resampled to the output grid
     * @param rawQcFile pre-merge QC CSV; computed from the raw inputs when absent
     * @param confounds per-volume confounds TSV of the merged series
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QcConfig(
        @JsonProperty("anatomicalMask") String anatomicalMask,
        @JsonProperty("dwiMask") String dwiMask,
        @JsonProperty("rawQcFile") String rawQcFile,
        @JsonProperty("confounds") String confounds
    ) {}

    /**
     * Artifact paths of one acquisition group.
     *
     * @param id group identifier, e.g. {@code dir-AP}
     * @param image corrected DWI series
     * @param bval b-values
     * @param bvec rotated b-vectors
     * @param originalBvec b-vectors before motion correction
     * @param originalImage uncorrected DWI series
     * @param rawConcatenatedImage raw inputs of the group concatenated
     * @param b0Ref b=0 reference volume
     * @param confounds optional per-volume confounds TSV of the group
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GroupConfig(
        @JsonProperty("id") String id,
        @JsonProperty("image") String image,
        @JsonProperty("bval") String bval,
        @JsonProperty("bvec") String bvec,
        @JsonProperty("originalBvec") String originalBvec,
        @JsonProperty("originalImage") String originalImage,
        @JsonProperty("rawConcatenatedImage") String rawConcatenatedImage,
        @JsonProperty("b0Ref") String b0Ref,
        @JsonProperty("confounds") String confounds
    ) {
        /**
         * Returns the configured path of every slot, omitting slots left empty.
         *
         * @return slot to path string
         */
        public Map<ArtifactSlot, String> slotPaths() {
            Map<ArtifactSlot, String> paths = new EnumMap<>(ArtifactSlot.class);
            putIfPresent(paths, ArtifactSlot.IMAGE, image);
            putIfPresent(paths, ArtifactSlot.BVAL, bval);
            putIfPresent(paths, ArtifactSlot.BVEC, bvec);
            putIfPresent(paths, ArtifactSlot.ORIGINAL_BVEC, originalBvec);
            putIfPresent(paths, ArtifactSlot.ORIGINAL_IMAGE, originalImage);
            putIfPresent(paths, ArtifactSlot.RAW_CONCATENATED_IMAGE, rawConcatenatedImage);
            putIfPresent(paths, ArtifactSlot.B0_REF, b0Ref);
            return paths;
        }

        private static void putIfPresent(Map<ArtifactSlot, String> paths, ArtifactSlot slot, String value) {
            if (value != null && !value.isBlank()) {
                paths.put(slot, value);
            }
        }
    }
}
