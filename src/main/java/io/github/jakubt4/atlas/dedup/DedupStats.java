package io.github.jakubt4.atlas.dedup;

public record DedupStats(long hits, long misses, int pending, double hitRate) {
}
