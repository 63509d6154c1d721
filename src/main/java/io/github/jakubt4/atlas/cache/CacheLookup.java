package io.github.jakubt4.atlas.cache;

import java.time.Duration;

/**
 * Result of a cache read: {@link Fresh}, {@link Stale} (usable, refresh advised) or {@link Miss}.
 */
public sealed interface CacheLookup<T> permits CacheLookup.Fresh, CacheLookup.Stale, CacheLookup.Miss {

    record Fresh<T>(T value, Duration age) implements CacheLookup<T> {
    }

    record Stale<T>(T value, Duration age) implements CacheLookup<T> {
    }

    record Miss<T>() implements CacheLookup<T> {
    }

    static <T> CacheLookup<T> miss() {
        return new Miss<>();
    }
}
