package io.github.jakubt4.atlas.controller;

import io.github.jakubt4.atlas.dto.ErrorResponse;
import io.github.jakubt4.atlas.orbit.TrackedComet;
import io.github.jakubt4.atlas.service.CometCatalogService;
import io.github.jakubt4.atlas.service.ObservationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
@RestController
@RequestMapping("/api/comets")
@RequiredArgsConstructor
public class CometCatalogController {

    private final CometCatalogService catalogService;
    private final ObservationService observationService;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<List<CometCatalogService.CometView>> listComets() {
        return ResponseEntity.ok(catalogService.describeAll(clock.instant()));
    }

    /**
     * Cached observation set of one tracked comet.
     *
     * @param designation designation, display name or COBS alias, e.g. {@code 3I} or {@code SWAN}
     * @return {@code 200 OK} with the set, {@code 404} for an unknown comet, {@code 503} when the
     *         observation network failed and nothing was cached
     */
    @GetMapping("/{designation}/observations")
    public CompletableFuture<ResponseEntity<?>> getObservations(@PathVariable final String designation) {
        final var comet = TrackedComet.resolve(designation);
        if (comet.isEmpty()) {
            return CompletableFuture.completedFuture(ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponse.of("REJECTED", "Unknown comet: " + designation)));
        }
        return observationService.getObservations(comet.get())
                .<ResponseEntity<?>>thenApply(ResponseEntity::ok)
                .exceptionally(error -> {
                    log.warn("Observations for [{}] unavailable: {}", designation, error.getMessage());
                    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                            .body(ErrorResponse.of("UNAVAILABLE", "Observation network unavailable"));
                });
    }
}
