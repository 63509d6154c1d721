package io.github.jakubt4.atlas;

import io.github.jakubt4.atlas.cache.StalenessAwareCache;
import io.github.jakubt4.atlas.model.EnhancedCometState;
import io.github.jakubt4.atlas.model.Observation;
import io.github.jakubt4.atlas.source.DataSource;
import io.github.jakubt4.atlas.source.EphemerisProvider;
import io.github.jakubt4.atlas.source.LiveCoordinatesProvider;
import io.github.jakubt4.atlas.source.ObservationProvider;
import io.github.jakubt4.atlas.source.ProviderUnavailableException;
import io.github.jakubt4.atlas.service.CometStateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
class AtlasTrackerApplicationTest {

    @Autowired
    private CometStateService cometStateService;

    @Autowired
    private StalenessAwareCache<EnhancedCometState> stateCache;

    @MockBean
    private ObservationProvider observationProvider;

    @MockBean
    private EphemerisProvider ephemerisProvider;

    @MockBean
    private LiveCoordinatesProvider liveCoordinatesProvider;

    @BeforeEach
    void setUp() {
        stateCache.clear();
    }

    @Test
    void stateIsAggregatedOnceAndServedFromCache() throws Exception {
        final var observedAt = Instant.now().minus(2, ChronoUnit.HOURS);
        when(observationProvider.fetchObservations("3I"))
                .thenReturn(List.of(new Observation(observedAt, 12.4, "sch01", "V", null, null, null)));
        when(ephemerisProvider.fetchEphemeris())
                .thenThrow(new ProviderUnavailableException(DataSource.JPL_HORIZONS, "Horizons unavailable"));
        when(liveCoordinatesProvider.fetchLiveCoordinates())
                .thenThrow(new ProviderUnavailableException(DataSource.THESKYLIVE, "No coordinates on page"));

        final var first = cometStateService.getEnhancedState().get(5, TimeUnit.SECONDS);
        final var second = cometStateService.getEnhancedState().get(5, TimeUnit.SECONDS);

        assertThat(first.jplEphemeris().positionSource()).isEqualTo("analytic");
        assertThat(first.comet().currentMagnitude()).isEqualTo(12.4);
        assertThat(first.sourceStatus().get("cobs").active()).isTrue();
        assertThat(first.sourceStatus().get("jpl_horizons").error()).isEqualTo("Horizons unavailable");
        assertThat(second).isEqualTo(first);
        verify(observationProvider, times(1)).fetchObservations("3I");
    }

    @Test
    void stateWithEveryProviderDownIsServedButNotCached() throws Exception {
        when(observationProvider.fetchObservations("3I"))
                .thenThrow(new ProviderUnavailableException(DataSource.COBS, "COBS unavailable"));
        when(ephemerisProvider.fetchEphemeris())
                .thenThrow(new ProviderUnavailableException(DataSource.JPL_HORIZONS, "Horizons unavailable"));
        when(liveCoordinatesProvider.fetchLiveCoordinates())
                .thenThrow(new ProviderUnavailableException(DataSource.THESKYLIVE, "TheSkyLive unavailable"));

        final var state = cometStateService.getEnhancedState().get(5, TimeUnit.SECONDS);

        assertThat(state.anySourceActive()).isFalse();
        assertThat(state.jplEphemeris().positionSource()).isEqualTo("analytic");
        assertThat(state.jplEphemeris().currentPosition()).isNotNull();
        assertThat(stateCache.contains(CometStateService.STATE_KEY)).isFalse();
    }
}
