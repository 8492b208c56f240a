package com.dwimerge.core.merge;

/**
 * Tolerances for deciding that two volumes sampled the same q-space coordinate.
 *
 * @param bValueTolerance maximum absolute b-value difference (s/mm²)
 * @param directionToleranceDegrees maximum angle between the two unit directions
 * @param antipodalMatching whether {@code v} and {@code -v} count as the same direction
 */
public record QSpaceTolerance(double bValueTolerance, double directionToleranceDegrees, boolean antipodalMatching) {

    public static final double DEFAULT_B_VALUE_TOLERANCE = 50.0;
    public static final double DEFAULT_DIRECTION_TOLERANCE_DEGREES = 5.0;

    /**
     * Compact constructor with validation.
     */
    public QSpaceTolerance {
        if (!(bValueTolerance >= 0)) {
            throw new IllegalArgumentException("bValueTolerance must be >= 0");
        }
        if (!(directionToleranceDegrees >= 0 && directionToleranceDegrees < 90)) {
            throw new IllegalArgumentException("directionToleranceDegrees must be in [0, 90)");
        }
    }

    public static QSpaceTolerance defaults() {
        return new QSpaceTolerance(DEFAULT_B_VALUE_TOLERANCE, DEFAULT_DIRECTION_TOLERANCE_DEGREES, true);
    }

    /**
     * Smallest acceptable |cos| (or cos, without antipodal matching) between two unit directions.
     *
     * @return cosine threshold
     */
    public double minimumCosine() {
        return Math.cos(Math.toRadians(directionToleranceDegrees));
    }
}
