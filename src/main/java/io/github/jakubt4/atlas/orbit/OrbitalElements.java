package io.github.jakubt4.atlas.orbit;

import java.time.Instant;
import java.util.Objects;

/**
 * Heliocentric osculating elements of a tracked body, referred to the ecliptic.
 *
 * @param eccentricity             orbit shape, {@code e > 1} for hyperbolic trajectories
 * @param perihelionDistance       q in AU
 * @param inclination              i in degrees
 * @param longitudeOfAscendingNode Ω in degrees
 * @param argumentOfPeriapsis      ω in degrees
 * @param perihelionEpoch          time of perihelion passage T
 */
public record OrbitalElements(double eccentricity,
                              double perihelionDistance,
                              double inclination,
                              double longitudeOfAscendingNode,
                              double argumentOfPeriapsis,
                              Instant perihelionEpoch) {

    public OrbitalElements {
        if (!(eccentricity >= 0.0) || !Double.isFinite(eccentricity)) {
            throw new IllegalArgumentException("Eccentricity must be finite and >= 0, got " + eccentricity);
        }
        if (!(perihelionDistance > 0.0) || !Double.isFinite(perihelionDistance)) {
            throw new IllegalArgumentException("Perihelion distance must be finite and > 0, got " + perihelionDistance);
        }
        Objects.requireNonNull(perihelionEpoch, "perihelionEpoch");
    }

    public boolean isHyperbolic() {
        return eccentricity > 1.0;
    }

    public boolean isParabolic() {
        return eccentricity == 1.0;
    }

    /**
     * Semi-major axis in AU, negative for hyperbolic orbits and undefined (infinite) for parabolic ones.
     */
    public double semiMajorAxis() {
        return perihelionDistance / (1.0 - eccentricity);
    }
}
