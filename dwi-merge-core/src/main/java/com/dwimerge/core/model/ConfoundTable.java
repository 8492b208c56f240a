package com.dwimerge.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-volume confound time series (motion parameters, framewise displacement, ...).
 *
 * <p>Columns keep their file order. Missing entries ({@code n/a}) are stored as {@link Double#NaN}.
 *
 * @param columns column name to per-volume values
 */
public record ConfoundTable(Map<String, List<Double>> columns) {

    /**
     * Compact constructor with validation.
     */
    public ConfoundTable {
        Objects.requireNonNull(columns, "columns must not be null");
        int rows = -1;
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> column : columns.entrySet()) {
            if (rows >= 0 && column.getValue().size() != rows) {
                throw new IllegalArgumentException("Confound column '" + column.getKey() + "' has "
                    + column.getValue().size() + " rows, expected " + rows);
            }
            rows = column.getValue().size();
            copy.put(column.getKey(), List.copyOf(column.getValue()));
        }
        columns = Collections.unmodifiableMap(copy);
    }

    public static ConfoundTable empty() {
        return new ConfoundTable(Map.of());
    }

    public int rowCount() {
        return columns.isEmpty() ? 0 : columns.values().iterator().next().size();
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<Double> column(String name) {
        return columns.getOrDefault(name, List.of());
    }
}
