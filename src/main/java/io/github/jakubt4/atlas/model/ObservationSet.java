package io.github.jakubt4.atlas.model;

import java.time.Instant;
import java.util.List;

/**
 * Everything derived from one observation-network fetch for a single comet. This is the unit
 * stored under {@code cobs:<designation>}.
 */
public record ObservationSet(String designation,
                             List<Observation> observations,
                             List<LightCurvePoint> lightCurve,
                             ObservationStatistics statistics,
                             Instant fetchedAt) {

    public ObservationSet {
        observations = observations == null ? List.of() : List.copyOf(observations);
        lightCurve = lightCurve == null ? List.of() : List.copyOf(lightCurve);
    }
}
