package com.dwimerge.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Read-only projection of a b-value/b-vector pair into unit directions plus magnitudes.
 *
 * <p>Row order follows the volume order of the series it was derived from.
 *
 * @param rows one row per volume
 */
public record GradientTable(List<Row> rows) {

    /** Width within which b-values count as one shell. */
    public static final double SHELL_WIDTH = 100.0;

    /**
     * One gradient row.
     *
     * @param direction unit direction, {@link Vector3#ZERO} for b=0
     * @param bValue effective b-value
     */
    public record Row(Vector3 direction, double bValue) {

        /**
         * Compact constructor with validation.
         */
        public Row {
            Objects.requireNonNull(direction, "direction must not be null");
        }
    }

    /**
     * Compact constructor with validation.
     */
    public GradientTable {
        Objects.requireNonNull(rows, "rows must not be null");
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    /**
     * Distinct b-values rounded to the nearest {@link #SHELL_WIDTH}, ascending.
     *
     * @return shell b-values
     */
    public List<Double> shells() {
        return shells(SHELL_WIDTH);
    }

    /**
     * Distinct b-values rounded to the nearest {@code rounding}, ascending.
     *
     * @param rounding shell width, e.g. 100
     * @return shell b-values
     */
    public List<Double> shells(double rounding) {
        TreeSet<Double> shells = new TreeSet<>();
        for (Row row : rows) {
            shells.add(Math.round(row.bValue() / rounding) * rounding);
        }
        return List.copyOf(shells);
    }

    public double maxBValue() {
        return rows.stream().mapToDouble(Row::bValue).max().orElse(0.0);
    }

    /**
     * Renders the table in MRtrix format: one {@code x y z b} line per volume.
     *
     * @return table text ending with a newline
     */
    public String toMrtrixFormat() {
        StringBuilder out = new StringBuilder();
        for (Row row : rows) {
            Vector3 d = row.direction();
            out.append(String.format(Locale.ROOT, "%.8f %.8f %.8f %.4f%n", d.x(), d.y(), d.z(), row.bValue()));
        }
        return out.toString();
    }
}
