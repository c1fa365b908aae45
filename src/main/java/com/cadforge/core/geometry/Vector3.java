package com.cadforge.core.geometry;

/**
 * Immutable 3D vector used by the analytic engine.
 */
public record Vector3(double x, double y, double z) {

    public static final Vector3 ZERO = new Vector3(0, 0, 0);

    public Vector3 minus(Vector3 other) {
        return new Vector3(x - other.x, y - other.y, z - other.z);
    }

    public double dot(Vector3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public Vector3 cross(Vector3 other) {
        return new Vector3(
                y * other.z - z * other.y,
                z * other.x - x * other.z,
                x * other.y - y * other.x);
    }

    public double length() {
        return Math.sqrt(dot(this));
    }

    public Vector3 normalized() {
        double len = length();
        if (len == 0) {
            throw new ArithmeticException("Cannot normalise a zero-length vector");
        }
        return new Vector3(x / len, y / len, z / len);
    }

    public double distanceTo(Vector3 other) {
        return minus(other).length();
    }
}
