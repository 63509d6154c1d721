package io.github.jakubt4.atlas.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Freshness rules of one cached dataset.
 *
 * @param maxAge        age up to which an entry is served as fresh
 * @param staleWindow   age up to which an entry is still served, with a background refresh; must exceed maxAge
 * @param schemaVersion entries written under any other version are treated as absent
 */
public record CachePolicy(Duration maxAge, Duration staleWindow, int schemaVersion) {

    public CachePolicy {
        Objects.requireNonNull(maxAge, "maxAge");
        Objects.requireNonNull(staleWindow, "staleWindow");
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive");
        }
        if (staleWindow.compareTo(maxAge) <= 0) {
            throw new IllegalArgumentException("staleWindow (" + staleWindow + ") must exceed maxAge (" + maxAge + ")");
        }
    }
}
