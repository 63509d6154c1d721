package io.github.jakubt4.atlas.source;

import io.github.jakubt4.atlas.model.ProviderCallState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SourceHealthRegistryTest {

    private static final Instant AT = Instant.parse("2025-10-01T00:00:00Z");

    private final SourceHealthRegistry registry = new SourceHealthRegistry();

    @Test
    void everySourceStartsNotAttempted() {
        final var snapshot = registry.snapshot();

        assertThat(snapshot).containsOnlyKeys("cobs", "jpl_horizons", "theskylive");
        assertThat(snapshot.values()).allSatisfy(health -> {
            assertThat(health.active()).isFalse();
            assertThat(health.lastUpdated()).isNull();
            assertThat(health.state()).isEqualTo(ProviderCallState.NOT_ATTEMPTED);
        });
    }

    @Test
    void successMarksActiveAndClearsError() {
        registry.recordFailure(DataSource.COBS, "timeout");
        registry.markInFlight(DataSource.COBS);
        registry.recordSuccess(DataSource.COBS, AT);

        final var health = registry.get(DataSource.COBS);
        assertThat(health.active()).isTrue();
        assertThat(health.lastUpdated()).isEqualTo(AT);
        assertThat(health.error()).isNull();
        assertThat(health.state()).isEqualTo(ProviderCallState.SUCCEEDED);
    }

    @Test
    void failureKeepsTimeOfLastSuccess() {
        registry.recordSuccess(DataSource.JPL_HORIZONS, AT);

        registry.recordFailure(DataSource.JPL_HORIZONS, "HTTP 503");

        final var health = registry.get(DataSource.JPL_HORIZONS);
        assertThat(health.active()).isFalse();
        assertThat(health.lastUpdated()).isEqualTo(AT);
        assertThat(health.error()).isEqualTo("HTTP 503");
        assertThat(health.state()).isEqualTo(ProviderCallState.FAILED);
    }

    @Test
    void inFlightKeepsPreviousOutcome() {
        registry.recordSuccess(DataSource.THESKYLIVE, AT);

        registry.markInFlight(DataSource.THESKYLIVE);

        final var health = registry.get(DataSource.THESKYLIVE);
        assertThat(health.active()).isTrue();
        assertThat(health.state()).isEqualTo(ProviderCallState.IN_FLIGHT);
    }

    @Test
    void snapshotIsDetachedFromLaterUpdates() {
        final var before = registry.snapshot();

        registry.recordSuccess(DataSource.COBS, AT);

        assertThat(before.get("cobs").active()).isFalse();
        assertThat(registry.snapshot().get("cobs").active()).isTrue();
    }
}
