package com.dwimerge.core.io;

import com.dwimerge.core.DwiFixtures;
import com.dwimerge.core.error.FormatException;
import com.dwimerge.core.error.MissingInputException;
import com.dwimerge.core.model.DwiImage;
import com.dwimerge.core.model.SpatialGrid;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link NiftiImageStore}.
 */
class NiftiImageStoreTest {

    @TempDir
    Path tempDir;

    private final NiftiImageStore store = new NiftiImageStore();

    @Test
    void write_thenRead_compressedSeriesKeepsVoxelsAndGrid() {
        SpatialGrid grid = new SpatialGrid(3, 2, 2, 1.5, 1.5, 2.0);
        DwiImage image = DwiFixtures.image(grid, 100, 10.5, 20);

        Path file = store.write(image, tempDir.resolve("sub/dwi.nii.gz"));
        DwiImage read = store.read(file);

        assertThat(read.grid()).isEqualTo(grid);
        assertThat(read.volumeCount()).isEqualTo(3);
        assertThat(read.volume(1)).containsExactly(image.volume(1));
    }

    @Test
    void write_singleVolume_readsBackAsThreeDimensional() {
        Path file = store.write(DwiFixtures.mask(3), tempDir.resolve("mask.nii"));

        DwiImage read = store.read(file);

        assertThat(read.volumeCount()).isEqualTo(1);
        assertThat(read.volume(0)).startsWith(1.0f, 1.0f, 1.0f, 0.0f);
    }

    @Test
    void read_bigEndianInt16WithScaling_appliesSlopeAndIntercept() throws Exception {
        ByteBuffer buffer = ByteBuffer.allocate(352 + 4).order(ByteOrder.BIG_ENDIAN);
        buffer.putInt(0, 348);
        buffer.putShort(40, (short) 3);
        buffer.putShort(42, (short) 2);
        buffer.putShort(44, (short) 1);
        buffer.putShort(46, (short) 1);
        buffer.putShort(70, (short) 4);
        buffer.putShort(72, (short) 16);
        buffer.putFloat(80, 2.0f);
        buffer.putFloat(84, 2.0f);
        buffer.putFloat(88, 2.0f);
        buffer.putFloat(108, 352f);
        buffer.putFloat(112, 2.0f);
        buffer.putFloat(116, 1.0f);
        buffer.put(344, (byte) 'n');
        buffer.put(345, (byte) '+');
        buffer.put(346, (byte) '1');
        buffer.putShort(352, (short) 10);
        buffer.putShort(354, (short) -3);
        Path file = Files.write(tempDir.resolve("scaled.nii"), buffer.array());

        DwiImage read = store.read(file);

        assertThat(read.grid().dx()).isEqualTo(2.0);
        assertThat(read.volume(0)).containsExactly(21.0f, -5.0f);
    }

    @Test
    void read_missingFile_throwsMissingInputException() {
        assertThatThrownBy(() -> store.read(tempDir.resolve("absent.nii.gz")))
            .isInstanceOf(MissingInputException.class);
    }

    @Test
    void read_notNifti_throwsFormatException() throws Exception {
        Path file = Files.write(tempDir.resolve("junk.nii"), new byte[400]);

        assertThatThrownBy(() -> store.read(file))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("sizeof_hdr");
    }

    @Test
    void read_truncatedData_throwsFormatException() throws Exception {
        Path full = store.write(DwiFixtures.image(DwiFixtures.GRID, 1, 2), tempDir.resolve("full.nii"));
        byte[] bytes = Files.readAllBytes(full);
        Path truncated = Files.write(tempDir.resolve("truncated.nii"), java.util.Arrays.copyOf(bytes, bytes.length - 8));

        assertThatThrownBy(() -> store.read(truncated))
            .isInstanceOf(FormatException.class)
            .hasMessageContaining("Truncated");
    }
}
