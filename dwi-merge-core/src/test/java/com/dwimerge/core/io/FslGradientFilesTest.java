package com.dwimerge.core.io;

import com.dwimerge.core.error.FormatException;
import com.dwimerge.core.error.MissingInputException;
import com.dwimerge.core.model.Vector3;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FslGradientFiles}.
 */
class FslGradientFilesTest {

    @TempDir
    Path tempDir;

    private final FslGradientFiles files = new FslGradientFiles();

    @Test
    void readBvecs_threeRows_returnsOneVectorPerColumn() throws Exception {
        Path file = Files.writeString(tempDir.resolve("dwi.bvec"), "0 1 0 0\n0 0 1 0\n0 0 0 1\n");

        List<Vector3> bvecs = files.readBvecs(file);

        assertThat(bvecs).containsExactly(Vector3.ZERO, new Vector3(1, 0, 0), new Vector3(0, 1, 0), new Vector3(0, 0, 1));
    }

    @Test
    void readBvecs_oneRowPerVolume_isAccepted() throws Exception {
        Path file = Files.writeString(tempDir.resolve("dwi.bvec"), "0 0 0\n1 0 0\n0 1 0\n0 0 1\n");

        assertThat(files.readBvecs(file)).hasSize(4).element(1).isEqualTo(new Vector3(1, 0, 0));
    }

    @Test
    void readBvals_multipleLines_areFlattened() throws Exception {
        Path file = Files.writeString(tempDir.resolve("dwi.bval"), "0 1000\n1000 2000\n");

        assertThat(files.readBvals(file)).containsExactly(0.0, 1000.0, 1000.0, 2000.0);
    }

    @Test
    void writeBvals_integralValues_writtenWithoutDecimals() throws Exception {
        Path file = files.writeBvals(List.of(0.0, 1000.0, 1500.5), tempDir.resolve("out.bval"));

        assertThat(Files.readString(file)).isEqualTo("0 1000 1500.50000000\n");
    }

    @Test
    void readBvals_nonNumericToken_throwsFormatException() throws Exception {
        Path file = Files.writeString(tempDir.resolve("dwi.bval"), "0 abc\n");

        assertThatThrownBy(() -> files.readBvals(file))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("abc");
    }

    @Test
    void readBvecs_raggedRows_throwsFormatException() throws Exception {
        Path file = Files.writeString(tempDir.resolve("dwi.bvec"), "0 1\n0 0 1 0\n");

        assertThatThrownBy(() -> files.readBvecs(file)).isInstanceOf(FormatException.class);
    }

    @Test
    void readBvals_emptyFile_throwsFormatException() throws Exception {
        Path file = Files.writeString(tempDir.resolve("dwi.bval"), "\n");

        assertThatThrownBy(() -> files.readBvals(file)).isInstanceOf(FormatException.class);
    }

    @Test
    void readBvals_missingFile_throwsMissingInputException() {
        assertThatThrownBy(() -> files.readBvals(tempDir.resolve("none.bval")))
            .isInstanceOf(MissingInputException.class);
    }
}
