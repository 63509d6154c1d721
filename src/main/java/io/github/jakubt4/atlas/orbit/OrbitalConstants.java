package io.github.jakubt4.atlas.orbit;

import org.hipparchus.util.FastMath;
import org.orekit.utils.Constants;

import java.time.Duration;
import java.time.Instant;

/**
 * Unit conversions and solar-system constants shared by the analytic models.
 */
public final class OrbitalConstants {

    public static final double AU_METERS = Constants.IAU_2012_ASTRONOMICAL_UNIT;
    public static final double AU_KM = AU_METERS / 1000.0;
    public static final double SECONDS_PER_DAY = Constants.JULIAN_DAY;

    /** Heliocentric gravitational parameter in AU^3/day^2. */
    public static final double SUN_MU_AU3_PER_DAY2 =
            Constants.IAU_2015_NOMINAL_SUN_GM * SECONDS_PER_DAY * SECONDS_PER_DAY
                    / (AU_METERS * AU_METERS * AU_METERS);

    /** Heliocentric gravitational parameter in km^3/s^2. */
    public static final double SUN_MU_KM3_PER_S2 = Constants.IAU_2015_NOMINAL_SUN_GM / 1.0e9;

    /** Mean obliquity of the ecliptic at J2000. */
    public static final double OBLIQUITY_J2000_DEG = 23.4392811;

    public static final Instant J2000 = Instant.parse("2000-01-01T12:00:00Z");

    private OrbitalConstants() {
    }

    public static double daysBetween(final Instant from, final Instant to) {
        final var elapsed = Duration.between(from, to);
        return (elapsed.getSeconds() + elapsed.getNano() / 1.0e9) / SECONDS_PER_DAY;
    }

    public static double auPerDayToKmPerSecond(final double auPerDay) {
        return auPerDay * AU_KM / SECONDS_PER_DAY;
    }

    public static double normalizeDegrees(final double degrees) {
        final var normalized = degrees % 360.0;
        final var positive = normalized < 0.0 ? normalized + 360.0 : normalized;
        // -1e-17 + 360 rounds to 360
        return positive >= 360.0 ? 0.0 : positive;
    }

    public static double clamp(final double value, final double min, final double max) {
        return FastMath.max(min, FastMath.min(max, value));
    }
}
