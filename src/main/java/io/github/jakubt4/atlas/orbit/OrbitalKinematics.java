package io.github.jakubt4.atlas.orbit;

import lombok.RequiredArgsConstructor;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Rates derived from the analytic model by central differences around the requested instant.
 */
@Component
@RequiredArgsConstructor
public class OrbitalKinematics {

    private static final Duration VELOCITY_STEP = Duration.ofHours(1);
    private static final Duration RATE_STEP = Duration.ofHours(12);

    private final OrbitalSolver solver;
    private final FrameConverter frameConverter;

    public Velocity3D velocity(final OrbitalElements elements, final Instant at) {
        final var before = solver.solvePosition(elements, at.minus(VELOCITY_STEP)).toVector();
        final var after = solver.solvePosition(elements, at.plus(VELOCITY_STEP)).toVector();
        return Velocity3D.of(after.subtract(before).scalarMultiply(1.0 / spanDays(VELOCITY_STEP)));
    }

    public Velocity3D earthVelocity(final Instant at) {
        final var before = frameConverter.earthPosition(at.minus(VELOCITY_STEP)).toVector();
        final var after = frameConverter.earthPosition(at.plus(VELOCITY_STEP)).toVector();
        return Velocity3D.of(after.subtract(before).scalarMultiply(1.0 / spanDays(VELOCITY_STEP)));
    }

    /**
     * Speed relative to the Earth in km/s.
     */
    public double geocentricSpeed(final Velocity3D heliocentric, final Instant at) {
        return Velocity3D.of(heliocentric.toVector().subtract(earthVelocity(at).toVector())).kmPerSecond();
    }

    /**
     * Apparent motion across the sky in arcsec/day.
     */
    public double angularRate(final OrbitalElements elements, final Instant at) {
        final var before = frameConverter.toEquatorial(solver.solvePosition(elements, at.minus(RATE_STEP)), at.minus(RATE_STEP));
        final var after = frameConverter.toEquatorial(solver.solvePosition(elements, at.plus(RATE_STEP)), at.plus(RATE_STEP));
        return frameConverter.angularSeparation(before.ra(), before.dec(), after.ra(), after.dec())
                / spanDays(RATE_STEP);
    }

    /**
     * Turn of the heliocentric velocity vector in degrees/day.
     */
    public double directionChange(final OrbitalElements elements, final Instant at) {
        final var before = velocity(elements, at.minus(RATE_STEP)).toVector();
        final var after = velocity(elements, at.plus(RATE_STEP)).toVector();
        return FastMath.toDegrees(Vector3D.angle(before, after)) / spanDays(RATE_STEP);
    }

    /**
     * Solar gravitational acceleration in km/s² at the given distance in AU.
     */
    public double solarAcceleration(final double heliocentricDistance) {
        final var rKm = heliocentricDistance * OrbitalConstants.AU_KM;
        return OrbitalConstants.SUN_MU_KM3_PER_S2 / (rKm * rKm);
    }

    /**
     * Mean change of heliocentric speed over the preceding {@code days}, in km/s per day.
     */
    public double speedTrend(final OrbitalElements elements, final Instant at, final int days) {
        final var now = solver.heliocentricSpeed(elements, at);
        final var earlier = solver.heliocentricSpeed(elements, at.minus(Duration.ofDays(days)));
        return (now - earlier) / days;
    }

    private static double spanDays(final Duration step) {
        return 2.0 * step.getSeconds() / OrbitalConstants.SECONDS_PER_DAY;
    }
}
