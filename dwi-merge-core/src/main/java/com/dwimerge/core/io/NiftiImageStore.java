package com.dwimerge.core.io;

import com.dwimerge.core.error.FormatException;
import com.dwimerge.core.error.MissingInputException;
import com.dwimerge.core.model.DwiImage;
import com.dwimerge.core.model.SpatialGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Reads and writes single-file NIfTI-1 images ({@code .nii} and {@code .nii.gz}).
 *
 * <p>Reading accepts the integer and floating point datatypes commonly produced by
 * converters, in either byte order, and applies {@code scl_slope}/{@code scl_inter}.
 * Writing always produces little-endian float32 with a scaled-identity sform.
 * Orientation matrices beyond voxel sizes are not carried through.
 */
public class NiftiImageStore {

    private static final Logger log = LoggerFactory.getLogger(NiftiImageStore.class);

    static final int HEADER_SIZE = 348;
    static final int VOX_OFFSET = 352;

    private static final short DT_UINT8 = 2;
    private static final short DT_INT16 = 4;
    private static final short DT_INT32 = 8;
    private static final short DT_FLOAT32 = 16;
    private static final short DT_FLOAT64 = 64;
    private static final short DT_INT8 = 256;
    private static final short DT_UINT16 = 512;

    /**
     * Loads an image.
     *
     * @param file image path
     * @return the image; a 3D file yields a single volume
     * @throws MissingInputException if the file does not exist
     * @throws FormatException if the file is not a readable NIfTI-1 image
     */
    public DwiImage read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new MissingInputException(file.toString(), "Image file not found");
        }
        byte[] bytes;
        try (InputStream in = open(file)) {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            throw new FormatException(file.toString(), "Cannot read image: " + e.getMessage(), e);
        }
        if (bytes.length < HEADER_SIZE) {
            throw new FormatException(file.toString(), "File is shorter than a NIfTI-1 header");
        }

        ByteBuffer header = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        if (header.getInt(0) != HEADER_SIZE) {
            header.order(ByteOrder.BIG_ENDIAN);
            if (header.getInt(0) != HEADER_SIZE) {
                throw new FormatException(file.toString(), "Not a NIfTI-1 file (sizeof_hdr != 348)");
            }
        }
        String magic = new String(bytes, 344, 3, StandardCharsets.US_ASCII);
        if (!"n+1".equals(magic)) {
            throw new FormatException(file.toString(), "Unsupported NIfTI magic '" + magic + "'; only single-file images are read");
        }

        int rank = header.getShort(40);
        if (rank < 3 || rank > 7) {
            throw new FormatException(file.toString(), "Unsupported image rank " + rank);
        }
        int nx = header.getShort(42);
        int ny = header.getShort(44);
        int nz = header.getShort(46);
        int nt = rank >= 4 ? Math.max(1, header.getShort(48)) : 1;
        for (int axis = 5; axis <= rank; axis++) {
            if (header.getShort(40 + 2 * axis) > 1) {
                throw new FormatException(file.toString(), "Images with more than four dimensions are not supported");
            }
        }
        short datatype = header.getShort(70);
        int bytesPerVoxel = bytesPerVoxel(file, datatype);
        SpatialGrid grid = new SpatialGrid(nx, ny, nz,
            Math.abs(header.getFloat(80)), Math.abs(header.getFloat(84)), Math.abs(header.getFloat(88)));

        int offset = (int) header.getFloat(108);
        float slope = header.getFloat(112);
        float intercept = header.getFloat(116);
        boolean scaled = slope != 0.0f && Float.isFinite(slope) && !(slope == 1.0f && intercept == 0.0f);

        long voxels = (long) grid.voxelCount();
        long needed = offset + voxels * nt * bytesPerVoxel;
        if (bytes.length < needed) {
            throw new FormatException(file.toString(), String.format(
                "Truncated image: header %s x %d volumes needs %d bytes, file has %d",
                grid.describe(), nt, needed, bytes.length));
        }

        ByteBuffer data = ByteBuffer.wrap(bytes).order(header.order());
        List<float[]> volumes = new ArrayList<>(nt);
        int position = offset;
        for (int t = 0; t < nt; t++) {
            float[] volume = new float[(int) voxels];
            for (int i = 0; i < volume.length; i++) {
                float value = readVoxel(data, position, datatype);
                volume[i] = scaled ? value * slope + intercept : value;
                position += bytesPerVoxel;
            }
            volumes.add(volume);
        }
        log.debug("Read {} ({} volumes, {})", file, nt, grid.describe());
        return new DwiImage(grid, volumes);
    }

    /**
     * Writes an image as float32 NIfTI-1, gzip-compressed when the name ends in {@code .gz}.
     *
     * @param image image to write
     * @param file destination, parent directories are created
     * @return {@code file}
     */
    public Path write(DwiImage image, Path file) {
        SpatialGrid grid = image.grid();
        int voxels = grid.voxelCount();
        ByteBuffer header = ByteBuffer.allocate(VOX_OFFSET).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(0, HEADER_SIZE);
        boolean fourD = image.volumeCount() > 1;
        header.putShort(40, (short) (fourD ? 4 : 3));
        header.putShort(42, (short) grid.nx());
        header.putShort(44, (short) grid.ny());
        header.putShort(46, (short) grid.nz());
        header.putShort(48, (short) (fourD ? image.volumeCount() : 1));
        for (int axis = 5; axis <= 7; axis++) {
            header.putShort(40 + 2 * axis, (short) 1);
        }
        header.putShort(70, DT_FLOAT32);
        header.putShort(72, (short) 32);
        header.putFloat(76, 1.0f);
        header.putFloat(80, (float) grid.dx());
        header.putFloat(84, (float) grid.dy());
        header.putFloat(88, (float) grid.dz());
        header.putFloat(92, 1.0f);
        header.putFloat(108, VOX_OFFSET);
        header.putFloat(112, 1.0f);
        header.put(123, (byte) 10);
        header.putShort(254, (short) 1);
        header.putFloat(280, (float) grid.dx());
        header.putFloat(300, (float) grid.dy());
        header.putFloat(320, (float) grid.dz());
        header.put(344, (byte) 'n');
        header.put(345, (byte) '+');
        header.put(346, (byte) '1');

        ByteBuffer data = ByteBuffer.allocate(voxels * 4).order(ByteOrder.LITTLE_ENDIAN);
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            try (OutputStream out = create(file)) {
                out.write(header.array());
                for (float[] volume : image.volumes()) {
                    data.clear();
                    data.asFloatBuffer().put(volume);
                    out.write(data.array());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write image " + file, e);
        }
        log.debug("Wrote {} ({} volumes)", file, image.volumeCount());
        return file;
    }

    private static InputStream open(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        return isCompressed(file) ? new GZIPInputStream(in) : in;
    }

    private static OutputStream create(Path file) throws IOException {
        OutputStream out = Files.newOutputStream(file);
        return isCompressed(file) ? new GZIPOutputStream(out) : out;
    }

    private static boolean isCompressed(Path file) {
        return file.getFileName().toString().endsWith(".gz");
    }

    private static int bytesPerVoxel(Path file, short datatype) {
        return switch (datatype) {
            case DT_UINT8, DT_INT8 -> 1;
            case DT_INT16, DT_UINT16 -> 2;
            case DT_INT32, DT_FLOAT32 -> 4;
            case DT_FLOAT64 -> 8;
            default -> throw new FormatException(file.toString(), "Unsupported NIfTI datatype " + datatype);
        };
    }

    private static float readVoxel(ByteBuffer data, int position, short datatype) {
        return switch (datatype) {
            case DT_UINT8 -> data.get(position) & 0xFF;
            case DT_INT8 -> data.get(position);
            case DT_INT16 -> data.getShort(position);
            case DT_UINT16 -> data.getShort(position) & 0xFFFF;
            case DT_INT32 -> data.getInt(position);
            case DT_FLOAT32 -> data.getFloat(position);
            case DT_FLOAT64 -> (float) data.getDouble(position);
            default -> throw new IllegalStateException("Unchecked datatype " + datatype);
        };
    }
}
