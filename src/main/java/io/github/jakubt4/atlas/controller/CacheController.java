package io.github.jakubt4.atlas.controller;

import io.github.jakubt4.atlas.cache.StalenessAwareCache;
import io.github.jakubt4.atlas.dedup.RequestDeduplicator;
import io.github.jakubt4.atlas.dto.CacheStatsResponse;
import io.github.jakubt4.atlas.dto.ErrorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheController {

    private final List<StalenessAwareCache<?>> caches;
    private final RequestDeduplicator deduplicator;

    @GetMapping("/stats")
    public ResponseEntity<CacheStatsResponse> getStats() {
        return ResponseEntity.ok(new CacheStatsResponse(
                caches.stream().map(StalenessAwareCache::stats).toList(),
                deduplicator.stats(),
                deduplicator.pendingKeys()));
    }

    /**
     * Drops {@code key} from every cache holding it, memory and disk. The key is a query parameter
     * because observation keys such as {@code cobs:C/2025 R2} contain a slash.
     */
    @DeleteMapping
    public ResponseEntity<ErrorResponse> invalidate(@RequestParam final String key) {
        if (key.isBlank()) {
            return ResponseEntity.badRequest().body(ErrorResponse.of("REJECTED", "key is required"));
        }
        final var holders = caches.stream().filter(cache -> cache.contains(key)).toList();
        if (holders.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponse.of("REJECTED", "No cache entry for " + key));
        }
        holders.forEach(cache -> cache.invalidate(key));
        log.info("Invalidated [{}] in {} cache(s)", key, holders.size());
        return ResponseEntity.ok(ErrorResponse.of("INVALIDATED", key));
    }
}
