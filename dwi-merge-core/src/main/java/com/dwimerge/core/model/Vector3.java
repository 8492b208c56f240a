package com.dwimerge.core.model;

/**
 * A three-component direction, used for b-vectors.
 *
 * @param x x component
 * @param y y component
 * @param z z component
 */
public record Vector3(double x, double y, double z) {

    /** The zero vector, used as the direction of b=0 volumes. */
    public static final Vector3 ZERO = new Vector3(0.0, 0.0, 0.0);

    /**
     * Compact constructor with validation.
     */
    public Vector3 {
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
            throw new IllegalArgumentException("Vector components must be finite: " + x + ", " + y + ", " + z);
        }
    }

    public double norm() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    public double dot(Vector3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public Vector3 plus(Vector3 other) {
        return new Vector3(x + other.x, y + other.y, z + other.z);
    }

    public Vector3 negate() {
        return new Vector3(-x, -y, -z);
    }

    /**
     * Returns true if the norm is below {@code epsilon}.
     *
     * @param epsilon tolerance
     * @return true for (numerically) zero vectors
     */
    public boolean isZero(double epsilon) {
        return norm() < epsilon;
    }

    /**
     * Returns the unit vector pointing in the same direction, or {@link #ZERO}
     * for a zero vector.
     *
     * @return normalized vector
     */
    public Vector3 normalized() {
        double n = norm();
        if (n < 1e-12) {
            return ZERO;
        }
        return new Vector3(x / n, y / n, z / n);
    }
}
