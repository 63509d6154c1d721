package io.github.jakubt4.atlas.dto;

import io.github.jakubt4.atlas.model.SourceHealth;

import java.time.Instant;
import java.util.Map;

/**
 * @param status {@code UP}, {@code DEGRADED}, {@code DOWN}, or {@code UNKNOWN} before the first round
 */
public record HealthResponse(String status, Map<String, SourceHealth> sources, Instant checkedAt) {
}
