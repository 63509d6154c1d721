package io.github.jakubt4.atlas.orbit;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Cartesian position in AU, heliocentric ecliptic frame unless stated otherwise.
 */
public record Position3D(double x, double y, double z) {

    public static Position3D of(final Vector3D vector) {
        return new Position3D(vector.getX(), vector.getY(), vector.getZ());
    }

    public Vector3D toVector() {
        return new Vector3D(x, y, z);
    }

    public double norm() {
        return toVector().getNorm();
    }
}
