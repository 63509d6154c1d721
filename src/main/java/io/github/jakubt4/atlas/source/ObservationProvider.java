package io.github.jakubt4.atlas.source;

import io.github.jakubt4.atlas.model.Observation;

import java.util.List;

public interface ObservationProvider {

    /**
     * Recent brightness reports, newest first, already normalised and filtered.
     *
     * @param designation the provider's designation of the comet (e.g. "3I")
     * @throws ProviderUnavailableException if the provider cannot be reached or answers with an error
     */
    List<Observation> fetchObservations(String designation);
}
