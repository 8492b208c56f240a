package com.dwimerge.core.io;

import com.dwimerge.core.error.FormatException;
import com.dwimerge.core.error.MissingInputException;
import com.dwimerge.core.model.Vector3;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * FSL-style gradient files: {@code .bval} holds whitespace-separated b-values, {@code .bvec}
 * holds three rows (x, y, z) with one column per volume.
 *
 * <p>A {@code .bvec} laid out as one row of three components per volume is also accepted.
 */
public class FslGradientFiles {

    public List<Double> readBvals(Path file) {
        List<List<Double>> rows = readNumbers(file);
        List<Double> bvals = new ArrayList<>();
        rows.forEach(bvals::addAll);
        return bvals;
    }

    /**
     * Reads b-vectors in either orientation.
     *
     * @param file bvec file
     * @return one vector per volume
     * @throws FormatException if the file is neither 3 x N nor N x 3
     */
    public List<Vector3> readBvecs(Path file) {
        List<List<Double>> rows = readNumbers(file);
        List<Vector3> vectors = new ArrayList<>();
        if (rows.size() == 3 && sameLength(rows)) {
            for (int i = 0; i < rows.get(0).size(); i++) {
                vectors.add(new Vector3(rows.get(0).get(i), rows.get(1).get(i), rows.get(2).get(i)));
            }
            return vectors;
        }
        if (rows.stream().allMatch(row -> row.size() == 3)) {
            rows.forEach(row -> vectors.add(new Vector3(row.get(0), row.get(1), row.get(2))));
            return vectors;
        }
        throw new FormatException(file.toString(),
            "b-vector file must have 3 rows of equal length or 3 values per row, found " + rows.size() + " rows");
    }

    public Path writeBvals(List<Double> bvals, Path file) {
        String line = bvals.stream().map(FslGradientFiles::format).collect(Collectors.joining(" "));
        return write(file, line + "\n");
    }

    public Path writeBvecs(List<Vector3> bvecs, Path file) {
        StringBuilder out = new StringBuilder();
        out.append(bvecs.stream().map(v -> format(v.x())).collect(Collectors.joining(" "))).append('\n');
        out.append(bvecs.stream().map(v -> format(v.y())).collect(Collectors.joining(" "))).append('\n');
        out.append(bvecs.stream().map(v -> format(v.z())).collect(Collectors.joining(" "))).append('\n');
        return write(file, out.toString());
    }

    private static List<List<Double>> readNumbers(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new MissingInputException(file.toString(), "Gradient file not found");
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FormatException(file.toString(), "Cannot read gradient file: " + e.getMessage(), e);
        }
        List<List<Double>> rows = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            List<Double> row = new ArrayList<>();
            for (String token : trimmed.split("[\\s,]+")) {
                try {
                    row.add(Double.parseDouble(token));
                } catch (NumberFormatException e) {
                    throw new FormatException(file.toString(), "Not a number: '" + token + "'", e);
                }
            }
            rows.add(row);
        }
        if (rows.isEmpty()) {
            throw new FormatException(file.toString(), "Gradient file is empty");
        }
        return rows;
    }

    private static boolean sameLength(List<List<Double>> rows) {
        return rows.stream().mapToInt(List::size).distinct().count() == 1;
    }

    private static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e9) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.8f", value);
    }

    private static Path write(Path file, String content) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write gradient file " + file, e);
        }
    }
}
