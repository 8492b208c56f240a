package com.dwimerge.core.io;

import com.dwimerge.core.config.MergeConfig;
import com.dwimerge.core.model.AcquisitionGroupSet;
import com.dwimerge.core.model.ArtifactSlot;
import com.dwimerge.core.model.ConfoundTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the configured artifact paths of every group and loads them into an
 * {@link AcquisitionGroupSet}.
 *
 * <p>Relative paths resolve against the base directory. An image referenced by several
 * slots (the original and raw concatenated series are often the same file) is read once.
 */
public class ArtifactLoader {

    private static final Logger log = LoggerFactory.getLogger(ArtifactLoader.class);

    private final Path baseDirectory;
    private final NiftiImageStore images;
    private final FslGradientFiles gradients;
    private final TabularFiles tables;

    public ArtifactLoader(Path baseDirectory) {
        this(baseDirectory, new NiftiImageStore(), new FslGradientFiles(), new TabularFiles());
    }

    public ArtifactLoader(Path baseDirectory, NiftiImageStore images, FslGradientFiles gradients, TabularFiles tables) {
        this.baseDirectory = baseDirectory;
        this.images = images;
        this.gradients = gradients;
        this.tables = tables;
    }

    /**
     * Loads every group.
     *
     * @param groups configured groups in merge order
     * @return validated group set
     */
    public AcquisitionGroupSet load(List<MergeConfig.GroupConfig> groups) {
        List<String> ids = new ArrayList<>();
        Map<String, Map<ArtifactSlot, Object>> fieldValues = new LinkedHashMap<>();
        Map<String, ConfoundTable> confounds = new HashMap<>();
        Map<Path, Object> cache = new HashMap<>();

        for (MergeConfig.GroupConfig group : groups) {
            ids.add(group.id());
            Map<ArtifactSlot, Object> slots = new EnumMap<>(ArtifactSlot.class);
            group.slotPaths().forEach((slot, path) -> slots.put(slot, loadSlot(slot, resolve(path), cache)));
            fieldValues.put(group.id(), slots);
            if (group.confounds() != null) {
                confounds.put(group.id(), tables.readConfounds(resolve(group.confounds())));
            }
            log.debug("Loaded {} slots for group {}", slots.size(), group.id());
        }

        AcquisitionGroupSet set = AcquisitionGroupSet.build(ids, fieldValues, confounds);
        log.info("Loaded {} acquisition groups ({} volumes)", set.size(), set.totalVolumeCount());
        return set;
    }

    /**
     * Resolves a configured path against the base directory.
     *
     * @param path configured path
     * @return absolute or base-relative path
     */
    public Path resolve(String path) {
        return baseDirectory.resolve(path).normalize();
    }

    private Object loadSlot(ArtifactSlot slot, Path path, Map<Path, Object> cache) {
        return switch (slot) {
            case IMAGE, ORIGINAL_IMAGE, RAW_CONCATENATED_IMAGE, B0_REF -> cache.computeIfAbsent(path, images::read);
            case BVAL -> gradients.readBvals(path);
            case BVEC, ORIGINAL_BVEC -> gradients.readBvecs(path);
        };
    }
}
