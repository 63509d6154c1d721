package io.github.jakubt4.atlas.controller;

import io.github.jakubt4.atlas.activity.ActivityReport;
import io.github.jakubt4.atlas.config.CacheProperties;
import io.github.jakubt4.atlas.model.EnhancedCometState;
import io.github.jakubt4.atlas.service.CometStateService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * Enhanced state and activity of 3I/ATLAS. Both endpoints always answer 200; degraded data is
 * flagged in {@code sourceStatus}.
 */
@RestController
@RequestMapping("/api/comet")
@RequiredArgsConstructor
public class CometStateController {

    private final CometStateService cometStateService;
    private final CacheProperties cacheProperties;

    @GetMapping("/state")
    public CompletableFuture<ResponseEntity<EnhancedCometState>> getState() {
        final var cacheControl = CacheControl.maxAge(cacheProperties.stateMaxAge()).cachePublic();
        return cometStateService.getEnhancedState()
                .thenApply(state -> ResponseEntity.ok()
                        .cacheControl(cacheControl)
                        .body(state));
    }

    @GetMapping("/activity")
    public CompletableFuture<ResponseEntity<ActivityReport>> getActivity() {
        return cometStateService.getActivityReport().thenApply(ResponseEntity::ok);
    }
}
