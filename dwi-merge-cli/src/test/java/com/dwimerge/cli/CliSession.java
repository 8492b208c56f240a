package com.dwimerge.cli;

import com.dwimerge.core.io.FslGradientFiles;
import com.dwimerge.core.io.NiftiImageStore;
import com.dwimerge.core.model.DwiImage;
import com.dwimerge.core.model.SpatialGrid;
import com.dwimerge.core.model.Vector3;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a two-group session and its configuration file for command tests.
 */
final class CliSession {

    private static final SpatialGrid GRID = SpatialGrid.isotropic(2, 2, 2);
    private static final List<Double> BVALS = List.of(0.0, 1000.0, 1000.0, 1000.0);
    private static final List<Vector3> DIRECTIONS = List.of(
        Vector3.ZERO, new Vector3(1, 0, 0), new Vector3(0, 1, 0), new Vector3(0, 0, 1));

    private CliSession() {
        // Utility class
    }

    /**
     * Writes {@code dir-AP} and {@code dir-PA} plus masks under {@code base} and a
     * {@code dwimerge.yaml} using the given strategy.
     *
     * @return the configuration file
     */
    static Path write(Path base, String strategy, boolean withMasks) throws IOException {
        writeGroup(base, "ap", 100, DIRECTIONS);
        writeGroup(base, "pa", 200, DIRECTIONS.stream().map(Vector3::negate).toList());
        NiftiImageStore images = new NiftiImageStore();
        images.write(mask(), base.resolve("anat_mask.nii.gz"));
        images.write(mask(), base.resolve("dwi_mask.nii.gz"));

        StringBuilder yaml = new StringBuilder();
        yaml.append("merging:\n  strategy: ").append(strategy).append('\n');
        yaml.append("output:\n  directory: derivatives\n  prefix: sub-01_dwi\n");
        if (withMasks) {
            yaml.append("qc:\n  anatomicalMask: anat_mask.nii.gz\n  dwiMask: dwi_mask.nii.gz\n");
        }
        yaml.append("groups:\n");
        for (String group : List.of("ap", "pa")) {
            yaml.append("  - id: dir-").append(group.toUpperCase()).append('\n')
                .append("    image: ").append(group).append("/dwi.nii.gz\n")
                .append("    bval: ").append(group).append("/dwi.bval\n")
                .append("    bvec: ").append(group).append("/dwi.bvec\n")
                .append("    originalBvec: ").append(group).append("/dwi.bvec\n")
                .append("    originalImage: ").append(group).append("/dwi.nii.gz\n")
                .append("    rawConcatenatedImage: ").append(group).append("/dwi.nii.gz\n")
                .append("    b0Ref: ").append(group).append("/b0.nii.gz\n");
        }
        return Files.writeString(base.resolve("dwimerge.yaml"), yaml.toString());
    }

    private static void writeGroup(Path base, String name, float b0, List<Vector3> directions) {
        List<float[]> volumes = new ArrayList<>();
        for (int v = 0; v < BVALS.size(); v++) {
            float[] data = new float[GRID.voxelCount()];
            for (int i = 0; i < data.length; i++) {
                data[i] = (v == 0 ? b0 : b0 / 10 + v) + i;
            }
            volumes.add(data);
        }
        NiftiImageStore images = new NiftiImageStore();
        FslGradientFiles gradients = new FslGradientFiles();
        Path directory = base.resolve(name);
        images.write(new DwiImage(GRID, volumes), directory.resolve("dwi.nii.gz"));
        images.write(DwiImage.single(GRID, volumes.get(0)), directory.resolve("b0.nii.gz"));
        gradients.writeBvals(BVALS, directory.resolve("dwi.bval"));
        gradients.writeBvecs(directions, directory.resolve("dwi.bvec"));
    }

    private static DwiImage mask() {
        float[] data = new float[GRID.voxelCount()];
        java.util.Arrays.fill(data, 1.0f);
        return DwiImage.single(GRID, data);
    }
}
