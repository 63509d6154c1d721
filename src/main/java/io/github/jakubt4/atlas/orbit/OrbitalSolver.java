package io.github.jakubt4.atlas.orbit;

import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Rotation;
import org.hipparchus.geometry.euclidean.threed.RotationConvention;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;

import static io.github.jakubt4.atlas.orbit.OrbitalConstants.SUN_MU_AU3_PER_DAY2;

/**
 * Two-body analytic position solver for elliptic, parabolic and hyperbolic heliocentric orbits.
 *
 * <p>Time since perihelion is turned into a mean anomaly, Kepler's equation is solved with
 * Newton-Raphson ({@code M = E - e sinE} for ellipses, {@code M = e sinhH - H} for hyperbolae,
 * Barker's equation in closed form for {@code e == 1}), and the orbital-plane position is rotated
 * by ω, i and Ω into the heliocentric ecliptic frame.
 *
 * <p>Stateless and side-effect free; safe to share across threads.
 */
@Slf4j
@Component
public class OrbitalSolver {

    static final int DEFAULT_MAX_ITERATIONS = 50;
    static final double DEFAULT_TOLERANCE = 1.0e-8;

    private final int maxIterations;
    private final double tolerance;

    public OrbitalSolver() {
        this(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    public OrbitalSolver(final int maxIterations, final double tolerance) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1");
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    /**
     * Heliocentric ecliptic position of the body at the given instant.
     *
     * @throws NonConvergenceException if Kepler's equation cannot be solved within the iteration cap
     */
    public Position3D solvePosition(final OrbitalElements elements, final Instant at) {
        final var days = OrbitalConstants.daysBetween(elements.perihelionEpoch(), at);
        final var e = elements.eccentricity();
        final var q = elements.perihelionDistance();

        final double trueAnomaly;
        final double radius;
        if (elements.isParabolic()) {
            final var w = 3.0 * FastMath.sqrt(SUN_MU_AU3_PER_DAY2 / (2.0 * q * q * q)) * days;
            final var y = FastMath.cbrt(w / 2.0 + FastMath.sqrt(w * w / 4.0 + 1.0));
            final var s = y - 1.0 / y;
            trueAnomaly = 2.0 * FastMath.atan(s);
            radius = q * (1.0 + s * s);
        } else if (elements.isHyperbolic()) {
            final var a = FastMath.abs(elements.semiMajorAxis());
            final var meanAnomaly = FastMath.sqrt(SUN_MU_AU3_PER_DAY2 / (a * a * a)) * days;
            final var h = solveHyperbolic(meanAnomaly, e);
            trueAnomaly = 2.0 * FastMath.atan(FastMath.sqrt((e + 1.0) / (e - 1.0)) * FastMath.tanh(h / 2.0));
            radius = a * (e * FastMath.cosh(h) - 1.0);
        } else {
            final var a = elements.semiMajorAxis();
            final var meanAnomaly = MathUtils.normalizeAngle(
                    FastMath.sqrt(SUN_MU_AU3_PER_DAY2 / (a * a * a)) * days, 0.0);
            final var eccentricAnomaly = solveElliptic(meanAnomaly, e);
            trueAnomaly = 2.0 * FastMath.atan2(
                    FastMath.sqrt(1.0 + e) * FastMath.sin(eccentricAnomaly / 2.0),
                    FastMath.sqrt(1.0 - e) * FastMath.cos(eccentricAnomaly / 2.0));
            radius = a * (1.0 - e * FastMath.cos(eccentricAnomaly));
        }

        final var inPlane = new Vector3D(radius * FastMath.cos(trueAnomaly), radius * FastMath.sin(trueAnomaly), 0.0);
        return Position3D.of(toEcliptic(elements, inPlane));
    }

    /**
     * Heliocentric speed in km/s from the vis-viva relation at the solved radius.
     */
    public double heliocentricSpeed(final OrbitalElements elements, final Instant at) {
        final var r = solvePosition(elements, at).norm();
        final var inverseA = elements.isParabolic() ? 0.0 : 1.0 / elements.semiMajorAxis();
        final var auPerDay = FastMath.sqrt(SUN_MU_AU3_PER_DAY2 * (2.0 / r - inverseA));
        return OrbitalConstants.auPerDayToKmPerSecond(auPerDay);
    }

    double solveElliptic(final double meanAnomaly, final double e) {
        var anomaly = e < 0.8 ? meanAnomaly : FastMath.PI * FastMath.signum(meanAnomaly);
        var residual = Double.NaN;
        for (var i = 0; i < maxIterations; i++) {
            residual = anomaly - e * FastMath.sin(anomaly) - meanAnomaly;
            final var step = residual / (1.0 - e * FastMath.cos(anomaly));
            anomaly -= step;
            if (!Double.isFinite(anomaly)) {
                break;
            }
            if (FastMath.abs(step) < tolerance) {
                return anomaly;
            }
        }
        throw new NonConvergenceException(meanAnomaly, maxIterations, residual);
    }

    double solveHyperbolic(final double meanAnomaly, final double e) {
        // Danby's starting value; f is convex on each side of zero so Newton approaches from above
        var anomaly = FastMath.signum(meanAnomaly) * FastMath.log(2.0 * FastMath.abs(meanAnomaly) / e + 1.8);
        var residual = Double.NaN;
        for (var i = 0; i < maxIterations; i++) {
            residual = e * FastMath.sinh(anomaly) - anomaly - meanAnomaly;
            final var step = residual / (e * FastMath.cosh(anomaly) - 1.0);
            anomaly -= step;
            if (!Double.isFinite(anomaly)) {
                break;
            }
            if (FastMath.abs(step) < tolerance) {
                return anomaly;
            }
        }
        throw new NonConvergenceException(meanAnomaly, maxIterations, residual);
    }

    private static Vector3D toEcliptic(final OrbitalElements elements, final Vector3D inPlane) {
        final var periapsis = new Rotation(Vector3D.PLUS_K,
                FastMath.toRadians(elements.argumentOfPeriapsis()), RotationConvention.VECTOR_OPERATOR);
        final var inclination = new Rotation(Vector3D.PLUS_I,
                FastMath.toRadians(elements.inclination()), RotationConvention.VECTOR_OPERATOR);
        final var node = new Rotation(Vector3D.PLUS_K,
                FastMath.toRadians(elements.longitudeOfAscendingNode()), RotationConvention.VECTOR_OPERATOR);
        return node.applyTo(inclination.applyTo(periapsis.applyTo(inPlane)));
    }
}
