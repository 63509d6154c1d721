package io.github.jakubt4.atlas.service;

import io.github.jakubt4.atlas.activity.ActivityClassifier;
import io.github.jakubt4.atlas.activity.ActivityReport;
import io.github.jakubt4.atlas.activity.ActivityResult;
import io.github.jakubt4.atlas.activity.ActivityTimeline;
import io.github.jakubt4.atlas.cache.CacheEntry;
import io.github.jakubt4.atlas.cache.CacheLookup;
import io.github.jakubt4.atlas.cache.StalenessAwareCache;
import io.github.jakubt4.atlas.dedup.RequestDeduplicator;
import io.github.jakubt4.atlas.model.EnhancedCometState;
import io.github.jakubt4.atlas.model.Observation;
import io.github.jakubt4.atlas.orbit.NonConvergenceException;
import io.github.jakubt4.atlas.orbit.OrbitalElements;
import io.github.jakubt4.atlas.orbit.OrbitalSolver;
import io.github.jakubt4.atlas.orbit.Position3D;
import io.github.jakubt4.atlas.orbit.TrackedComet;
import io.github.jakubt4.atlas.source.ProviderResults;
import io.github.jakubt4.atlas.source.SourceAggregationEngine;
import io.github.jakubt4.atlas.source.SourceHealthRegistry;
import io.github.jakubt4.atlas.source.StateMerger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Query facade of the tracker.
 *
 * <p>{@link #getEnhancedState()} serves the cached state while it is fresh, serves a stale one
 * while a single background round refreshes it, and otherwise waits for a round. Concurrent
 * callers share one round through the deduplicator. The returned future never fails: when every
 * provider is down the last cached state is returned, or a state built from the analytic model
 * alone if nothing was ever cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CometStateService {

    public static final String STATE_KEY = "enhanced-comet-state";

    private final SourceAggregationEngine aggregationEngine;
    private final StalenessAwareCache<EnhancedCometState> stateCache;
    private final RequestDeduplicator deduplicator;
    private final StateMerger stateMerger;
    private final SourceHealthRegistry healthRegistry;
    private final ActivityClassifier activityClassifier;
    private final ActivityTimeline activityTimeline;
    private final OrbitalSolver solver;
    private final Clock clock;

    public CompletableFuture<EnhancedCometState> getEnhancedState() {
        final var lookup = stateCache.get(STATE_KEY);
        if (lookup instanceof CacheLookup.Fresh<EnhancedCometState> fresh) {
            return CompletableFuture.completedFuture(fresh.value());
        }
        if (lookup instanceof CacheLookup.Stale<EnhancedCometState> stale) {
            log.debug("Serving stale state ({}s old), refreshing in background", stale.age().toSeconds());
            refresh();
            return CompletableFuture.completedFuture(stale.value());
        }
        return refresh();
    }

    /**
     * Starts an aggregation round unless one is already running, and returns its outcome.
     */
    public CompletableFuture<EnhancedCometState> refresh() {
        return deduplicator.dedupe(STATE_KEY, this::fetchAndStore);
    }

    public ActivityResult getActivity(final List<Observation> observations, final Double heliocentricDistance) {
        return activityClassifier.classify(observations, heliocentricDistance);
    }

    /**
     * Analytic heliocentric position, or empty if the solver does not converge.
     */
    public Optional<Position3D> getOrbitalPosition(final OrbitalElements elements, final Instant at) {
        try {
            return Optional.of(solver.solvePosition(elements, at));
        } catch (final NonConvergenceException e) {
            log.warn("[POSITION_UNAVAILABLE] {}", e.getMessage());
            return Optional.empty();
        }
    }

    public CompletableFuture<ActivityReport> getActivityReport() {
        final var elements = TrackedComet.ATLAS_3I.getElements();
        return getEnhancedState().thenApply(state -> {
            final var timeline = activityTimeline.build(state.comet().observations(),
                    at -> getOrbitalPosition(elements, at).map(Position3D::norm).orElse(null));
            return new ActivityReport(state.activity(), timeline, ActivityTimeline.trend(timeline), state.generatedAt());
        });
    }

    private CompletableFuture<EnhancedCometState> fetchAndStore() {
        return aggregationEngine.aggregate()
                .thenApply(state -> {
                    if (state.anySourceActive()) {
                        stateCache.put(STATE_KEY, state);
                        return state;
                    }
                    log.warn("[DEGRADED] every provider failed, serving last known state");
                    return lastKnownOr(state);
                })
                .exceptionally(error -> {
                    log.error("[DEGRADED] aggregation round failed: {}", error.getMessage());
                    return lastKnownOr(null);
                });
    }

    private EnhancedCometState lastKnownOr(final EnhancedCometState fallback) {
        final var health = healthRegistry.snapshot();
        return stateCache.getIgnoringAge(STATE_KEY)
                .map(CacheEntry::payload)
                .map(cached -> cached.withSourceStatus(health))
                .orElseGet(() -> fallback != null ? fallback : minimalState());
    }

    private EnhancedCometState minimalState() {
        return stateMerger.merge(TrackedComet.ATLAS_3I, ProviderResults.allFailed("aggregation failed"),
                healthRegistry.snapshot(), clock.instant());
    }
}
