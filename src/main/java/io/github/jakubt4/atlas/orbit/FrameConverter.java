package io.github.jakubt4.atlas.orbit;

import org.hipparchus.geometry.euclidean.threed.Rotation;
import org.hipparchus.geometry.euclidean.threed.RotationConvention;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.time.Instant;

import static io.github.jakubt4.atlas.orbit.OrbitalConstants.clamp;

/**
 * Converts heliocentric ecliptic positions into geocentric equatorial sky coordinates.
 *
 * <p>The Earth is placed with a low-order solar model (mean anomaly plus the leading
 * equation-of-centre term), good to roughly 0.01° over a few decades around J2000.
 * Trigonometric inputs are clamped so floating-point overshoot never yields NaN.
 */
@Component
public class FrameConverter {

    private static final double ARCSEC_PER_RADIAN = 206264.806247;

    private final Rotation eclipticToEquatorial = new Rotation(Vector3D.PLUS_I,
            FastMath.toRadians(OrbitalConstants.OBLIQUITY_J2000_DEG), RotationConvention.VECTOR_OPERATOR);

    public EquatorialPosition toEquatorial(final Position3D position, final Instant at) {
        final var heliocentric = position.toVector();
        final var geocentricEcliptic = heliocentric.subtract(earthPosition(at).toVector());
        final var equatorial = eclipticToEquatorial.applyTo(geocentricEcliptic);

        final var geocentricDistance = equatorial.getNorm();
        if (geocentricDistance == 0.0) {
            return new EquatorialPosition(0.0, 0.0, heliocentric.getNorm(), 0.0);
        }

        final var ra = OrbitalConstants.normalizeDegrees(
                FastMath.toDegrees(FastMath.atan2(equatorial.getY(), equatorial.getX())));
        final var dec = FastMath.toDegrees(FastMath.asin(clamp(equatorial.getZ() / geocentricDistance, -1.0, 1.0)));
        return new EquatorialPosition(ra, dec, heliocentric.getNorm(), geocentricDistance);
    }

    /**
     * Inverse of {@link #toEquatorial}: places a body seen at (ra, dec) at the given geocentric
     * distance back into the heliocentric ecliptic frame.
     */
    public Position3D toHeliocentric(final double ra, final double dec, final double geocentricDistance,
                                     final Instant at) {
        final var direction = new Vector3D(FastMath.toRadians(ra), FastMath.toRadians(dec));
        final var geocentricEcliptic = eclipticToEquatorial.applyInverseTo(direction.scalarMultiply(geocentricDistance));
        return Position3D.of(geocentricEcliptic.add(earthPosition(at).toVector()));
    }

    /**
     * Heliocentric ecliptic position of the Earth in AU.
     */
    public Position3D earthPosition(final Instant at) {
        final var d = OrbitalConstants.daysBetween(OrbitalConstants.J2000, at);
        final var g = FastMath.toRadians(357.529 + 0.98560028 * d);
        final var meanLongitude = 280.459 + 0.98564736 * d;
        final var sunLongitude = FastMath.toRadians(
                meanLongitude + 1.915 * FastMath.sin(g) + 0.020 * FastMath.sin(2.0 * g));
        final var sunDistance = 1.00014 - 0.01671 * FastMath.cos(g) - 0.00014 * FastMath.cos(2.0 * g);

        // Earth sits opposite the geocentric Sun
        return new Position3D(
                -sunDistance * FastMath.cos(sunLongitude),
                -sunDistance * FastMath.sin(sunLongitude),
                0.0);
    }

    /**
     * Great-circle separation of two sky positions in arcseconds.
     */
    public double angularSeparation(final double ra1, final double dec1, final double ra2, final double dec2) {
        final var d1 = FastMath.toRadians(dec1);
        final var d2 = FastMath.toRadians(dec2);
        final var cosAngle = FastMath.sin(d1) * FastMath.sin(d2)
                + FastMath.cos(d1) * FastMath.cos(d2) * FastMath.cos(FastMath.toRadians(ra1 - ra2));
        return FastMath.acos(clamp(cosAngle, -1.0, 1.0)) * ARCSEC_PER_RADIAN;
    }
}
