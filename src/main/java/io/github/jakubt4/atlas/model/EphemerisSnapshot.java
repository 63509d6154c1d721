package io.github.jakubt4.atlas.model;

import io.github.jakubt4.atlas.orbit.Position3D;
import io.github.jakubt4.atlas.orbit.Velocity3D;

import java.time.Instant;

/**
 * Heliocentric ecliptic state vector reported by the ephemeris service.
 *
 * @param magnitude predicted total magnitude when the service supplies one, otherwise {@code null}
 * @param epoch     instant the state refers to
 */
public record EphemerisSnapshot(Position3D position, Velocity3D velocity, Double magnitude, Instant epoch) {
}
