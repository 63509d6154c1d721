package io.github.jakubt4.atlas.service;

import io.github.jakubt4.atlas.cache.StalenessAwareCache;
import io.github.jakubt4.atlas.model.EnhancedCometState;
import io.github.jakubt4.atlas.model.ObservationSet;
import io.github.jakubt4.atlas.orbit.TrackedComet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Restores persisted cache entries on start-up and refreshes the enhanced state periodically, so
 * the first poll after expiry usually hits a fresh entry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tracker.cache", name = "warmup-enabled", havingValue = "true", matchIfMissing = true)
public class CacheWarmer {

    private final StalenessAwareCache<EnhancedCometState> stateCache;
    private final StalenessAwareCache<ObservationSet> observationCache;
    private final CometStateService cometStateService;

    @EventListener(ApplicationReadyEvent.class)
    public void preload() {
        final var observationKeys = Arrays.stream(TrackedComet.values())
                .map(ObservationService::cacheKey)
                .toList();
        stateCache.preload(List.of(CometStateService.STATE_KEY))
                .thenCombine(observationCache.preload(observationKeys), Integer::sum)
                .thenAccept(restored -> log.info("[CACHE_PRELOAD] {} entries restored from disk", restored));
    }

    @Scheduled(fixedDelayString = "${tracker.cache.warmup-interval:PT4M}",
               initialDelayString = "${tracker.cache.warmup-initial-delay:PT30S}")
    public void warmUp() {
        log.debug("[WARMUP] refreshing enhanced state");
        cometStateService.refresh()
                .thenAccept(state -> log.debug("[WARMUP] state generated at {}", state.generatedAt()));
    }
}
