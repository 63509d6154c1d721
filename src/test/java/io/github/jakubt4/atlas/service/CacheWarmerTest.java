package io.github.jakubt4.atlas.service;

import io.github.jakubt4.atlas.cache.StalenessAwareCache;
import io.github.jakubt4.atlas.model.EnhancedCometState;
import io.github.jakubt4.atlas.model.ObservationSet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CacheWarmerTest {

    @SuppressWarnings("unchecked")
    private final StalenessAwareCache<EnhancedCometState> stateCache = mock(StalenessAwareCache.class);
    @SuppressWarnings("unchecked")
    private final StalenessAwareCache<ObservationSet> observationCache = mock(StalenessAwareCache.class);
    private final CometStateService cometStateService = mock(CometStateService.class);

    private final CacheWarmer warmer = new CacheWarmer(stateCache, observationCache, cometStateService);

    @Test
    void preloadRestoresStateAndEveryObservationKey() {
        when(stateCache.preload(anyCollection())).thenReturn(CompletableFuture.completedFuture(1));
        when(observationCache.preload(anyCollection())).thenReturn(CompletableFuture.completedFuture(2));

        warmer.preload();

        verify(stateCache).preload(List.of("enhanced-comet-state"));
        verify(observationCache).preload(List.of("cobs:3I", "cobs:C/2025 R2", "cobs:C/2025 A6",
                "cobs:C/2025 K1", "cobs:C/2024 E1"));
    }

    @Test
    void warmUpTriggersRefresh() {
        when(cometStateService.refresh()).thenReturn(new CompletableFuture<>());

        warmer.warmUp();

        verify(cometStateService).refresh();
    }
}
