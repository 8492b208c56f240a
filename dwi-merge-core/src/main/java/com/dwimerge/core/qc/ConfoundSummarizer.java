package com.dwimerge.core.qc;

import com.dwimerge.core.model.ConfoundSummary;
import com.dwimerge.core.model.ConfoundTable;

import java.util.List;

/**
 * Reduces a per-volume confounds table to the motion columns of the series QC row.
 *
 * <p>Reads {@code framewise_displacement} plus {@code rot_x/y/z} and {@code trans_x/y/z}.
 * Non-finite entries (such as the undefined displacement of the first volume) are skipped.
 * A column that is absent yields {@link Double#NaN} for the metrics derived from it.
 */
public final class ConfoundSummarizer {

    static final String FRAMEWISE_DISPLACEMENT = "framewise_displacement";
    static final List<String> ROTATIONS = List.of("rot_x", "rot_y", "rot_z");
    static final List<String> TRANSLATIONS = List.of("trans_x", "trans_y", "trans_z");

    private ConfoundSummarizer() {
        // Utility class
    }

    public static ConfoundSummary summarize(ConfoundTable table) {
        if (table == null || table.rowCount() == 0) {
            return ConfoundSummary.unavailable();
        }
        double meanFd = Double.NaN;
        double maxFd = Double.NaN;
        if (table.hasColumn(FRAMEWISE_DISPLACEMENT)) {
            List<Double> fd = table.column(FRAMEWISE_DISPLACEMENT);
            meanFd = fd.stream().filter(Double::isFinite).mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
            maxFd = fd.stream().filter(Double::isFinite).mapToDouble(Double::doubleValue).max().orElse(Double.NaN);
        }
        return new ConfoundSummary(
            meanFd,
            maxFd,
            maxAbsolute(table, ROTATIONS),
            maxAbsolute(table, TRANSLATIONS),
            maxRelative(table, ROTATIONS),
            maxRelative(table, TRANSLATIONS));
    }

    private static double maxAbsolute(ConfoundTable table, List<String> columns) {
        double max = Double.NaN;
        for (String name : columns) {
            if (!table.hasColumn(name)) {
                continue;
            }
            for (double value : table.column(name)) {
                if (Double.isFinite(value) && !(Math.abs(value) <= max)) {
                    max = Math.abs(value);
                }
            }
        }
        return max;
    }

    private static double maxRelative(ConfoundTable table, List<String> columns) {
        double max = Double.NaN;
        for (String name : columns) {
            if (!table.hasColumn(name)) {
                continue;
            }
            List<Double> values = table.column(name);
            for (int i = 1; i < values.size(); i++) {
                double delta = Math.abs(values.get(i) - values.get(i - 1));
                if (Double.isFinite(delta) && !(delta <= max)) {
                    max = delta;
                }
            }
        }
        return max;
    }
}
