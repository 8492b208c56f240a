package com.dwimerge.core.merge;

import com.dwimerge.core.error.ConfigException;

import java.util.Locale;

/**
 * The two merge algorithms. Chosen once per run, never per group.
 */
public enum MergeStrategyType {
    /** Average volumes that sampled the same q-space coordinate in different groups. */
    AVERAGE("average"),
    /** Concatenate all groups along the diffusion axis. */
    CONCATENATE("concat");

    /** Configuration key the strategy is read from. */
    public static final String CONFIG_KEY = "merging_strategy";

    private final String id;

    MergeStrategyType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Parses the strategy selector. Case-insensitive; {@code "average"} selects
     * {@link #AVERAGE} and any value starting with {@code "concat"} selects
     * {@link #CONCATENATE}.
     *
     * @param value configured value
     * @return strategy type
     * @throws ConfigException for null or unrecognized values
     */
    public static MergeStrategyType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException(CONFIG_KEY, "Merge strategy must be set to 'average' or 'concat'");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("average")) {
            return AVERAGE;
        }
        if (normalized.startsWith("concat")) {
            return CONCATENATE;
        }
        throw new ConfigException(CONFIG_KEY, "Unknown merge strategy '" + value
            + "'. Use 'average' or 'concat'");
    }
}
