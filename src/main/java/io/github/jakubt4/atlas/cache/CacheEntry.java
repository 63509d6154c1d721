package io.github.jakubt4.atlas.cache;

import java.time.Instant;

/**
 * Immutable cached value. A newer write replaces the whole entry, never individual fields.
 */
public record CacheEntry<T>(T payload, Instant storedAt, int schemaVersion) {
}
