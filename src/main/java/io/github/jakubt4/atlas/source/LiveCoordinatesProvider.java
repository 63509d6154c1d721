package io.github.jakubt4.atlas.source;

import io.github.jakubt4.atlas.model.LiveCoordinates;

public interface LiveCoordinatesProvider {

    /**
     * @throws ProviderUnavailableException if the provider cannot be reached or answers with an error
     */
    LiveCoordinates fetchLiveCoordinates();
}
