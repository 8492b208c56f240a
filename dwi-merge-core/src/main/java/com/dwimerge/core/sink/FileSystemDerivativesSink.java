package com.dwimerge.core.sink;

import com.dwimerge.core.error.MissingInputException;
import com.dwimerge.core.io.FslGradientFiles;
import com.dwimerge.core.io.NiftiImageStore;
import com.dwimerge.core.io.TabularFiles;
import com.dwimerge.core.model.MergedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sink that writes derivatives to a directory.
 *
 * <p>Creates the directory automatically and overwrites existing files. File names are
 * {@code <prefix>_<suffix>}:
 * <ul>
 *   <li>{@code merged_image}: {@code _dwi.nii.gz}</li>
 *   <li>{@code merged_bval} / {@code merged_bvec}: {@code _dwi.bval} / {@code _dwi.bvec}</li>
 *   <li>{@code gradient_table_t1}: {@code _dwi.b} (MRtrix)</li>
 *   <li>{@code merged_qc}: {@code _desc-ImageQC_dwi.csv}</li>
 *   <li>noise maps: {@code _desc-<label>_noise.nii.gz}</li>
 *   <li>pass-through artifacts: {@code _<name>} plus the source extension</li>
 * </ul>
 * The source file is only logged; the sink does not interpret it.
 */
public class FileSystemDerivativesSink implements DerivativesSink {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemDerivativesSink.class);

    private final Path outputDirectory;
    private final NiftiImageStore images;
    private final FslGradientFiles gradients;
    private final TabularFiles tables;

    public FileSystemDerivativesSink(Path outputDirectory) {
        this(outputDirectory, new NiftiImageStore(), new FslGradientFiles(), new TabularFiles());
    }

    public FileSystemDerivativesSink(Path outputDirectory, NiftiImageStore images,
                                     FslGradientFiles gradients, TabularFiles tables) {
        this.outputDirectory = outputDirectory;
        this.images = images;
        this.gradients = gradients;
        this.tables = tables;
    }

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public Map<String, Path> write(DerivativesBundle bundle) {
        logger.info("Writing derivatives of {} to: {}",
            bundle.sourceFile() != null ? bundle.sourceFile() : bundle.prefix(), outputDirectory);
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDirectory, e);
        }

        String prefix = bundle.prefix();
        MergedDataset dataset = bundle.dataset();
        Map<String, Path> written = new LinkedHashMap<>();
        written.put("merged_image", images.write(dataset.image(), target(prefix, "_dwi.nii.gz")));
        written.put("merged_bval", gradients.writeBvals(dataset.bvals(), target(prefix, "_dwi.bval")));
        written.put("merged_bvec", gradients.writeBvecs(dataset.bvecs(), target(prefix, "_dwi.bvec")));
        written.put("gradient_table_t1", writeText(target(prefix, "_dwi.b"), bundle.gradientTable().toMrtrixFormat()));
        written.put("merged_qc", tables.writeSeriesQc(bundle.seriesQc(), target(prefix, "_desc-ImageQC_dwi.csv")));
        bundle.noiseMaps().forEach((label, map) ->
            written.put("noise_" + label, images.write(map, target(prefix, "_desc-" + label + "_noise.nii.gz"))));
        bundle.passThrough().forEach((name, source) -> written.put(name, copy(prefix, name, source)));

        logger.info("Successfully wrote {} derivatives", written.size());
        return written;
    }

    private Path target(String prefix, String suffix) {
        return outputDirectory.resolve(prefix + suffix);
    }

    private Path writeText(Path target, String content) {
        try {
            Files.writeString(target, content);
            logger.debug("Wrote file: {} ({} bytes)", target, content.length());
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }

    private Path copy(String prefix, String name, Path source) {
        if (!Files.isRegularFile(source)) {
            throw new MissingInputException(name, "Pass-through artifact not found: " + source);
        }
        Path target = target(prefix, "_" + name + extension(source));
        try {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            logger.debug("Copied {} -> {}", source, target);
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to copy " + source + " to " + target, e);
        }
    }

    static String extension(Path file) {
        String name = file.getFileName().toString();
        if (name.endsWith(".nii.gz")) {
            return ".nii.gz";
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }
}
