package io.github.jakubt4.atlas.source;

import io.github.jakubt4.atlas.config.AggregationProperties;
import io.github.jakubt4.atlas.model.EnhancedCometState;
import io.github.jakubt4.atlas.orbit.TrackedComet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Fetches all providers concurrently and merges whatever arrived.
 *
 * <p>Each call runs on the tracker executor with its own timeout and ends in exactly one
 * {@link ProviderResult}; a result that arrives after its timeout is dropped. Health moves
 * IN_FLIGHT when the call starts and SUCCEEDED or FAILED when it settles. The merge starts
 * once all three calls are terminal, so a slow provider delays the round by at most its timeout.
 */
@Slf4j
@Service
public class SourceAggregationEngine {

    private final ObservationProvider observationProvider;
    private final EphemerisProvider ephemerisProvider;
    private final LiveCoordinatesProvider liveCoordinatesProvider;
    private final SourceHealthRegistry healthRegistry;
    private final StateMerger stateMerger;
    private final AggregationProperties properties;
    private final Executor executor;
    private final Clock clock;

    public SourceAggregationEngine(final ObservationProvider observationProvider,
                                   final EphemerisProvider ephemerisProvider,
                                   final LiveCoordinatesProvider liveCoordinatesProvider,
                                   final SourceHealthRegistry healthRegistry,
                                   final StateMerger stateMerger,
                                   final AggregationProperties properties,
                                   @Qualifier("trackerExecutor") final Executor executor,
                                   final Clock clock) {
        this.observationProvider = observationProvider;
        this.ephemerisProvider = ephemerisProvider;
        this.liveCoordinatesProvider = liveCoordinatesProvider;
        this.healthRegistry = healthRegistry;
        this.stateMerger = stateMerger;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    public CompletableFuture<EnhancedCometState> aggregate() {
        final var comet = TrackedComet.ATLAS_3I;
        final var startedAt = clock.instant();
        log.debug("[AGGREGATE] round started for {}", comet.getDisplayName());

        final var observations = call(DataSource.COBS,
                () -> observationProvider.fetchObservations(comet.getCobsDesignation()));
        final var ephemeris = call(DataSource.JPL_HORIZONS, ephemerisProvider::fetchEphemeris);
        final var live = call(DataSource.THESKYLIVE, liveCoordinatesProvider::fetchLiveCoordinates);

        return CompletableFuture.allOf(observations, ephemeris, live)
                .thenApply(ignored -> {
                    final var results = new ProviderResults(observations.join(), ephemeris.join(), live.join());
                    final var state = stateMerger.merge(comet, results, healthRegistry.snapshot(), clock.instant());
                    log.info("[AGGREGATE] round finished in {} ms, position from {}",
                            Duration.between(startedAt, clock.instant()).toMillis(), state.jplEphemeris().positionSource());
                    return state;
                });
    }

    private <T> CompletableFuture<ProviderResult<T>> call(final DataSource source, final Supplier<T> fetch) {
        healthRegistry.markInFlight(source);
        CompletableFuture<T> attempt;
        try {
            attempt = CompletableFuture.supplyAsync(fetch, executor);
        } catch (final RejectedExecutionException e) {
            attempt = CompletableFuture.failedFuture(e);
        }
        return attempt
                .thenApply(data -> data == null
                        ? ProviderResult.<T>failed("empty response")
                        : ProviderResult.succeeded(data))
                .exceptionally(error -> ProviderResult.failed(reason(error)))
                .completeOnTimeout(ProviderResult.failed("timeout after " + properties.providerTimeout().toMillis() + " ms"),
                        properties.providerTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(result -> {
                    record(source, result);
                    return result;
                });
    }

    private void record(final DataSource source, final ProviderResult<?> result) {
        if (result instanceof ProviderResult.Failed<?> failed) {
            healthRegistry.recordFailure(source, failed.reason());
        } else {
            healthRegistry.recordSuccess(source, clock.instant());
        }
    }

    private static String reason(final Throwable error) {
        final var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
