package io.github.jakubt4.atlas.source;

import io.github.jakubt4.atlas.model.EphemerisSnapshot;
import io.github.jakubt4.atlas.model.LiveCoordinates;
import io.github.jakubt4.atlas.model.Observation;

import java.util.List;

/**
 * The three provider outcomes of one aggregation round, all terminal.
 */
public record ProviderResults(ProviderResult<List<Observation>> observations,
                              ProviderResult<EphemerisSnapshot> ephemeris,
                              ProviderResult<LiveCoordinates> liveCoordinates) {

    public static ProviderResults allFailed(final String reason) {
        return new ProviderResults(ProviderResult.failed(reason), ProviderResult.failed(reason),
                ProviderResult.failed(reason));
    }
}
