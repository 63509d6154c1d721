package io.github.jakubt4.atlas.model;

import java.time.Instant;

/**
 * Apparent sky position scraped from the real-time coordinates service.
 *
 * @param ra                 right ascension in degrees
 * @param dec                declination in degrees
 * @param geocentricDistance distance from the Earth in AU
 * @param magnitude          latest observed magnitude, {@code null} when the page shows none
 */
public record LiveCoordinates(double ra,
                              double dec,
                              double geocentricDistance,
                              Double magnitude,
                              Instant retrievedAt) {
}
