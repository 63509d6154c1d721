package io.github.jakubt4.atlas.source;

import io.github.jakubt4.atlas.model.EphemerisSnapshot;

public interface EphemerisProvider {

    /**
     * Current heliocentric state vector of the tracked comet.
     *
     * @throws ProviderUnavailableException if the provider cannot be reached or answers with an error
     */
    EphemerisSnapshot fetchEphemeris();
}
