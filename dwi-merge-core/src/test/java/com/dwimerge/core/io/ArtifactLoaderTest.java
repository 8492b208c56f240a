package com.dwimerge.core.io;

import com.dwimerge.core.DwiFixtures;
import com.dwimerge.core.SessionFiles;
import com.dwimerge.core.config.MergeConfig;
import com.dwimerge.core.error.MissingInputException;
import com.dwimerge.core.error.ValidationException;
import com.dwimerge.core.model.AcquisitionGroupSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ArtifactLoader}.
 */
class ArtifactLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_writtenGroups_restoresOrderAndTables() {
        AcquisitionGroupSet original = DwiFixtures.mirroredPair();
        MergeConfig.GroupConfig ap = SessionFiles.write(tempDir, original.get(0));
        MergeConfig.GroupConfig pa = SessionFiles.write(tempDir, original.get(1));

        AcquisitionGroupSet loaded = new ArtifactLoader(tempDir).load(List.of(pa, ap));

        assertThat(loaded.ids()).containsExactly("dir_PA", "dir_AP");
        assertThat(loaded.get(1).bvals()).containsExactlyElementsOf(original.get(0).bvals());
        assertThat(loaded.get(1).image().volume(0)).containsExactly(original.get(0).image().volume(0));
        assertThat(loaded.get(0).originalImage()).isSameAs(loaded.get(0).rawConcatenatedImage());
    }

    @Test
    void load_groupConfounds_areAttached() throws Exception {
        MergeConfig.GroupConfig ap = SessionFiles.write(tempDir, DwiFixtures.mirroredPair().get(0));
        Files.writeString(tempDir.resolve("dir_AP/confounds.tsv"),
            "framewise_displacement\nn/a\n0.1\n0.2\n0.1\n0.3\n");
        MergeConfig.GroupConfig withConfounds = new MergeConfig.GroupConfig(ap.id(), ap.image(), ap.bval(),
            ap.bvec(), ap.originalBvec(), ap.originalImage(), ap.rawConcatenatedImage(), ap.b0Ref(),
            "dir_AP/confounds.tsv");

        AcquisitionGroupSet loaded = new ArtifactLoader(tempDir).load(List.of(withConfounds));

        assertThat(loaded.get(0).confounds().rowCount()).isEqualTo(5);
    }

    @Test
    void load_missingImage_throwsMissingInputException() {
        MergeConfig.GroupConfig ap = SessionFiles.write(tempDir, DwiFixtures.mirroredPair().get(0));
        MergeConfig.GroupConfig broken = new MergeConfig.GroupConfig(ap.id(), "dir_AP/absent.nii.gz", ap.bval(),
            ap.bvec(), ap.originalBvec(), ap.originalImage(), ap.rawConcatenatedImage(), ap.b0Ref(), null);

        assertThatThrownBy(() -> new ArtifactLoader(tempDir).load(List.of(broken)))
            .isInstanceOf(MissingInputException.class)
            .hasMessageContaining("absent.nii.gz");
    }

    @Test
    void load_unconfiguredSlot_throwsValidationException() {
        MergeConfig.GroupConfig ap = SessionFiles.write(tempDir, DwiFixtures.mirroredPair().get(0));
        MergeConfig.GroupConfig noB0 = new MergeConfig.GroupConfig(ap.id(), ap.image(), ap.bval(),
            ap.bvec(), ap.originalBvec(), ap.originalImage(), ap.rawConcatenatedImage(), null, null);

        assertThatThrownBy(() -> new ArtifactLoader(tempDir).load(List.of(noB0)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("dir_AP");
    }

    @Test
    void resolve_relativePath_isNormalizedAgainstBase() {
        assertThat(new ArtifactLoader(tempDir).resolve("a/../dwi.nii.gz")).isEqualTo(tempDir.resolve("dwi.nii.gz"));
    }
}
