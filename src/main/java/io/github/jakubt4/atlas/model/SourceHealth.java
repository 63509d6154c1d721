package io.github.jakubt4.atlas.model;

import java.time.Instant;

/**
 * Last known health of one upstream provider.
 *
 * @param active      whether the latest call succeeded
 * @param lastUpdated time of the latest successful call, {@code null} if there never was one
 * @param error       reason of the latest failure, {@code null} after a success
 * @param state       progress of the current or latest call
 */
public record SourceHealth(boolean active, Instant lastUpdated, String error, ProviderCallState state) {

    public static SourceHealth notAttempted() {
        return new SourceHealth(false, null, null, ProviderCallState.NOT_ATTEMPTED);
    }
}
