package com.dwimerge.core.denoise;

import com.dwimerge.core.io.NiftiImageStore;
import com.dwimerge.core.model.DwiImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.stream.Stream;

/**
 * Denoises with MRtrix3 {@code dwidenoise} (MP-PCA), run as an external process.
 *
 * <p>The input is written to a private temporary directory, the tool is invoked as
 * {@code dwidenoise in.nii out.nii -extent w,w,w -noise noise.nii -nthreads 1 -force}
 * and both outputs are read back. The directory is removed afterwards.
 */
public class MrtrixDenoiser implements Denoiser {

    private static final Logger log = LoggerFactory.getLogger(MrtrixDenoiser.class);
    private static final int KEPT_OUTPUT_LINES = 20;

    private final String executable;
    private final NiftiImageStore store;

    public MrtrixDenoiser() {
        this("dwidenoise", new NiftiImageStore());
    }

    public MrtrixDenoiser(String executable, NiftiImageStore store) {
        this.executable = executable;
        this.store = store;
    }

    @Override
    public String getId() {
        return "dwidenoise";
    }

    @Override
    public DenoiseResult denoise(DwiImage image, DenoiseSettings settings, String label) {
        Path workDir = createWorkDir(label);
        try {
            Path input = store.write(image, workDir.resolve("input.nii"));
            Path output = workDir.resolve("denoised.nii");
            Path noise = workDir.resolve("noise.nii");
            run(command(input, output, noise, settings), label);
            return new DenoiseResult(store.read(output), store.read(noise));
        } finally {
            deleteQuietly(workDir);
        }
    }

    List<String> command(Path input, Path output, Path noise, DenoiseSettings settings) {
        return List.of(executable, input.toString(), output.toString(),
            "-extent", settings.extent(), "-noise", noise.toString(), "-nthreads", "1", "-force");
    }

    private void run(List<String> command, String label) {
        log.info("Denoising {} with {}", label, String.join(" ", command));
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot start " + executable + "; is MRtrix3 installed?", e);
        }

        Deque<String> tail = new ArrayDeque<>();
        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[{}] {}", label, line);
                tail.addLast(line);
                if (tail.size() > KEPT_OUTPUT_LINES) {
                    tail.removeFirst();
                }
            }
            int exit = process.waitFor();
            if (exit != 0) {
                throw new IllegalStateException(String.format("%s failed for %s (exit %d):%n%s",
                    executable, label, exit, String.join(System.lineSeparator(), tail)));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read output of " + executable, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IllegalStateException("Interrupted while denoising " + label, e);
        }
    }

    private static Path createWorkDir(String label) {
        try {
            return Files.createTempDirectory("dwimerge-denoise-" + label.replaceAll("[^A-Za-z0-9_]", "_") + "-");
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create temporary directory for denoising", e);
        }
    }

    private static void deleteQuietly(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Could not delete temporary file {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up {}: {}", directory, e.getMessage());
        }
    }
}
