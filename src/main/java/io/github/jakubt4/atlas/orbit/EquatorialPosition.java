package io.github.jakubt4.atlas.orbit;

/**
 * Geocentric sky position with the distances it was derived from.
 *
 * @param ra                   right ascension in degrees, [0, 360)
 * @param dec                  declination in degrees, [-90, 90]
 * @param heliocentricDistance distance from the Sun in AU
 * @param geocentricDistance   distance from the Earth in AU
 */
public record EquatorialPosition(double ra, double dec, double heliocentricDistance, double geocentricDistance) {
}
