package io.github.jakubt4.atlas.service;

import io.github.jakubt4.atlas.activity.ObservationAnalyzer;
import io.github.jakubt4.atlas.cache.CacheEntry;
import io.github.jakubt4.atlas.cache.CacheLookup;
import io.github.jakubt4.atlas.cache.StalenessAwareCache;
import io.github.jakubt4.atlas.config.AggregationProperties;
import io.github.jakubt4.atlas.dedup.RequestDeduplicator;
import io.github.jakubt4.atlas.model.ObservationSet;
import io.github.jakubt4.atlas.orbit.TrackedComet;
import io.github.jakubt4.atlas.source.ObservationProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Observation sets per tracked comet, cached under {@code cobs:<designation>} with the same
 * fresh/stale/miss handling as the enhanced state.
 */
@Slf4j
@Service
public class ObservationService {

    private final ObservationProvider observationProvider;
    private final ObservationAnalyzer analyzer;
    private final StalenessAwareCache<ObservationSet> observationCache;
    private final RequestDeduplicator deduplicator;
    private final AggregationProperties properties;
    private final Executor executor;
    private final Clock clock;

    public ObservationService(final ObservationProvider observationProvider,
                              final ObservationAnalyzer analyzer,
                              final StalenessAwareCache<ObservationSet> observationCache,
                              final RequestDeduplicator deduplicator,
                              final AggregationProperties properties,
                              @Qualifier("trackerExecutor") final Executor executor,
                              final Clock clock) {
        this.observationProvider = observationProvider;
        this.analyzer = analyzer;
        this.observationCache = observationCache;
        this.deduplicator = deduplicator;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    public static String cacheKey(final TrackedComet comet) {
        return "cobs:" + comet.getCobsDesignation();
    }

    /**
     * Completes exceptionally with the provider error only when nothing was ever cached for the comet.
     */
    public CompletableFuture<ObservationSet> getObservations(final TrackedComet comet) {
        final var key = cacheKey(comet);
        final var lookup = observationCache.get(key);
        if (lookup instanceof CacheLookup.Fresh<ObservationSet> fresh) {
            return CompletableFuture.completedFuture(fresh.value());
        }
        if (lookup instanceof CacheLookup.Stale<ObservationSet> stale) {
            refresh(comet).exceptionally(error -> {
                log.warn("Background refresh of {} failed, keeping stale entry: {}", key, error.getMessage());
                return stale.value();
            });
            return CompletableFuture.completedFuture(stale.value());
        }
        return refresh(comet).exceptionally(error -> observationCache.getIgnoringAge(key)
                .map(CacheEntry::payload)
                .orElseThrow(() -> error instanceof CompletionException ? (CompletionException) error
                        : new CompletionException(error)));
    }

    public CompletableFuture<ObservationSet> refresh(final TrackedComet comet) {
        final var key = cacheKey(comet);
        return deduplicator.dedupe(key, () -> CompletableFuture
                .supplyAsync(() -> observationProvider.fetchObservations(comet.getCobsDesignation()), executor)
                .orTimeout(properties.providerTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(observations -> {
                    final var set = analyzer.summarize(comet, observations, clock.instant());
                    observationCache.put(key, set);
                    return set;
                }));
    }
}
