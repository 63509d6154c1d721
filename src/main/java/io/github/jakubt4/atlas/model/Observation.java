package io.github.jakubt4.atlas.model;

import java.time.Instant;

/**
 * One brightness report from the observation network, normalised at the client boundary.
 *
 * @param date        UTC time of the observation
 * @param magnitude   total visual magnitude, {@code null} if the report carried none
 * @param observerId  ICQ observer code, lower case
 * @param filter      photometric method or filter key (e.g. "V", "S", "C")
 * @param aperture    instrument aperture in cm, may be {@code null}
 * @param coma        coma diameter in arcminutes, may be {@code null}
 * @param quality     derived from the reported magnitude uncertainty, may be {@code null}
 */
public record Observation(Instant date,
                          Double magnitude,
                          String observerId,
                          String filter,
                          Double aperture,
                          Double coma,
                          ObservationQuality quality) {
}
