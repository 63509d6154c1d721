package io.github.jakubt4.atlas.orbit;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Heliocentric ecliptic velocity in AU/day.
 */
public record Velocity3D(double vx, double vy, double vz) {

    public static Velocity3D of(final Vector3D v) {
        return new Velocity3D(v.getX(), v.getY(), v.getZ());
    }

    public Vector3D toVector() {
        return new Vector3D(vx, vy, vz);
    }

    public double kmPerSecond() {
        return OrbitalConstants.auPerDayToKmPerSecond(toVector().getNorm());
    }
}
