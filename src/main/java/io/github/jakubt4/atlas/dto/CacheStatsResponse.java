package io.github.jakubt4.atlas.dto;

import io.github.jakubt4.atlas.cache.CacheStats;
import io.github.jakubt4.atlas.dedup.DedupStats;

import java.util.List;

public record CacheStatsResponse(List<CacheStats> caches, DedupStats deduplication, List<String> pendingKeys) {
}
