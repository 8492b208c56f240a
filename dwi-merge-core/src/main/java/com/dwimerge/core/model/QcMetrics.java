package com.dwimerge.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named image quality metrics, in insertion order.
 *
 * <p>Values that could not be computed are {@link Double#NaN}.
 *
 * @param values metric name to value
 */
public record QcMetrics(Map<String, Double> values) {

    /**
     * Compact constructor with validation.
     */
    public QcMetrics {
        Objects.requireNonNull(values, "values must not be null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static QcMetrics empty() {
        return new QcMetrics(Map.of());
    }

    public double get(String name) {
        return values.getOrDefault(name, Double.NaN);
    }

    /**
     * Returns the metrics with every name prefixed, skipping names that already carry it.
     *
     * @param prefix prefix such as {@code raw_}
     * @return prefixed metrics
     */
    public QcMetrics prefixed(String prefix) {
        Map<String, Double> prefixed = new LinkedHashMap<>();
        values.forEach((name, value) -> prefixed.put(name.startsWith(prefix) ? name : prefix + name, value));
        return new QcMetrics(prefixed);
    }
}
