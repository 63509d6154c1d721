package io.github.jakubt4.atlas.source;

import io.github.jakubt4.atlas.model.ProviderCallState;
import io.github.jakubt4.atlas.model.SourceHealth;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health of each provider. Only the aggregation engine writes, one slot per provider; readers
 * take an immutable snapshot.
 */
@Slf4j
@Component
public class SourceHealthRegistry {

    private final Map<DataSource, AtomicReference<SourceHealth>> health = new EnumMap<>(DataSource.class);

    public SourceHealthRegistry() {
        for (final var source : DataSource.values()) {
            health.put(source, new AtomicReference<>(SourceHealth.notAttempted()));
        }
    }

    public void markInFlight(final DataSource source) {
        health.get(source).updateAndGet(previous ->
                new SourceHealth(previous.active(), previous.lastUpdated(), previous.error(), ProviderCallState.IN_FLIGHT));
    }

    public void recordSuccess(final DataSource source, final Instant at) {
        final var previous = health.get(source).getAndSet(new SourceHealth(true, at, null, ProviderCallState.SUCCEEDED));
        if (!previous.active() && previous.state() != ProviderCallState.NOT_ATTEMPTED) {
            log.info("[SOURCE_UP] {} recovered", source.getKey());
        }
    }

    /**
     * Marks the provider failed. The time of the last success is kept so clients can tell how old
     * the newest good data is.
     */
    public void recordFailure(final DataSource source, final String reason) {
        final var previous = health.get(source).getAndUpdate(p ->
                new SourceHealth(false, p.lastUpdated(), reason, ProviderCallState.FAILED));
        if (previous.active() || previous.state() != ProviderCallState.FAILED) {
            log.warn("[SOURCE_DOWN] {}: {}", source.getKey(), reason);
        }
    }

    public SourceHealth get(final DataSource source) {
        return health.get(source).get();
    }

    /**
     * Current health keyed by {@link DataSource#getKey()}, in declaration order.
     */
    public Map<String, SourceHealth> snapshot() {
        final var snapshot = new LinkedHashMap<String, SourceHealth>();
        for (final var source : DataSource.values()) {
            snapshot.put(source.getKey(), health.get(source).get());
        }
        return snapshot;
    }
}
