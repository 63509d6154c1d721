package io.github.jakubt4.atlas.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.atlas.activity.ObservationAnalyzer;
import io.github.jakubt4.atlas.cache.CachePolicy;
import io.github.jakubt4.atlas.cache.StalenessAwareCache;
import io.github.jakubt4.atlas.config.AggregationProperties;
import io.github.jakubt4.atlas.dedup.RequestDeduplicator;
import io.github.jakubt4.atlas.model.Observation;
import io.github.jakubt4.atlas.model.ObservationSet;
import io.github.jakubt4.atlas.orbit.TrackedComet;
import io.github.jakubt4.atlas.source.DataSource;
import io.github.jakubt4.atlas.source.ObservationProvider;
import io.github.jakubt4.atlas.source.ProviderUnavailableException;
import io.github.jakubt4.atlas.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ObservationServiceTest {

    private static final Instant START = Instant.parse("2025-10-01T00:00:00Z");
    private static final List<Observation> OBSERVATIONS = List.of(
            new Observation(Instant.parse("2025-09-30T20:00:00Z"), 12.3, "a", "V", null, null, null));

    private final ObservationProvider provider = mock(ObservationProvider.class);

    private MutableClock clock;
    private ObservationService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        final var cache = new StalenessAwareCache<>("observations",
                new CachePolicy(Duration.ofMinutes(5), Duration.ofHours(48), 1),
                ObservationSet.class, null, new ObjectMapper(), Runnable::run, clock);
        service = new ObservationService(provider, new ObservationAnalyzer(), cache, new RequestDeduplicator(),
                new AggregationProperties(Duration.ofSeconds(2), 4), Runnable::run, clock);
    }

    @Test
    void cacheKeyUsesCobsDesignation() {
        assertThat(ObservationService.cacheKey(TrackedComet.ATLAS_3I)).isEqualTo("cobs:3I");
        assertThat(ObservationService.cacheKey(TrackedComet.LEMMON)).isEqualTo("cobs:C/2025 A6");
    }

    @Test
    void missFetchesSummarisesAndCaches() {
        when(provider.fetchObservations("3I")).thenReturn(OBSERVATIONS);

        final var set = service.getObservations(TrackedComet.ATLAS_3I).join();
        service.getObservations(TrackedComet.ATLAS_3I).join();

        assertThat(set.designation()).isEqualTo("C/2025 N1");
        assertThat(set.observations()).isEqualTo(OBSERVATIONS);
        assertThat(set.lightCurve()).hasSize(1);
        assertThat(set.fetchedAt()).isEqualTo(START);
        verify(provider, times(1)).fetchObservations("3I");
    }

    @Test
    void failureWithNothingCachedIsPropagated() {
        when(provider.fetchObservations("3I"))
                .thenThrow(new ProviderUnavailableException(DataSource.COBS, "COBS unavailable"));

        assertThatThrownBy(() -> service.getObservations(TrackedComet.ATLAS_3I).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ProviderUnavailableException.class);
    }

    @Test
    void failureAfterExpiryServesLastKnownSet() {
        when(provider.fetchObservations("3I")).thenReturn(OBSERVATIONS);
        service.getObservations(TrackedComet.ATLAS_3I).join();
        clock.advance(Duration.ofHours(49));
        when(provider.fetchObservations("3I"))
                .thenThrow(new ProviderUnavailableException(DataSource.COBS, "COBS unavailable"));

        final var set = service.getObservations(TrackedComet.ATLAS_3I).join();

        assertThat(set.fetchedAt()).isEqualTo(START);
    }

    @Test
    void staleSetIsServedAndRefreshedInBackground() {
        when(provider.fetchObservations("3I")).thenReturn(OBSERVATIONS);
        service.getObservations(TrackedComet.ATLAS_3I).join();
        clock.advance(Duration.ofMinutes(30));

        final var served = service.getObservations(TrackedComet.ATLAS_3I).join();
        final var refreshed = service.getObservations(TrackedComet.ATLAS_3I).join();

        assertThat(served.fetchedAt()).isEqualTo(START);
        assertThat(refreshed.fetchedAt()).isEqualTo(START.plus(Duration.ofMinutes(30)));
        verify(provider, times(2)).fetchObservations("3I");
    }
}
