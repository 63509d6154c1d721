package io.github.jakubt4.atlas.cache;

public record CacheStats(String name,
                         int entries,
                         long freshHits,
                         long staleHits,
                         long misses,
                         boolean persistent) {
}
