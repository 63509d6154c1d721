package io.github.jakubt4.atlas.controller;

import io.github.jakubt4.atlas.dto.OrbitPositionResponse;
import io.github.jakubt4.atlas.orbit.FrameConverter;
import io.github.jakubt4.atlas.orbit.NonConvergenceException;
import io.github.jakubt4.atlas.orbit.OrbitalSolver;
import io.github.jakubt4.atlas.orbit.TrackedComet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Analytic two-body position of a tracked comet.
 */
@Slf4j
@RestController
@RequestMapping("/api/orbit")
@RequiredArgsConstructor
public class OrbitController {

    private final OrbitalSolver solver;
    private final FrameConverter frameConverter;
    private final Clock clock;

    /**
     * @param designation designation, display name or COBS alias
     * @param at          ISO-8601 instant, defaults to now
     * @return {@code 200 OK} with the position, {@code 400} for a malformed instant, {@code 404} for
     *         an unknown comet, {@code 422} if Kepler's equation did not converge
     */
    @GetMapping("/position")
    public ResponseEntity<OrbitPositionResponse> getPosition(@RequestParam final String designation,
                                                             @RequestParam(required = false) final String at) {
        final var comet = TrackedComet.resolve(designation);
        if (comet.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(OrbitPositionResponse.rejected(designation, "Unknown comet"));
        }

        final Instant instant;
        try {
            instant = at == null || at.isBlank() ? clock.instant() : Instant.parse(at);
        } catch (final DateTimeParseException e) {
            return ResponseEntity.badRequest()
                    .body(OrbitPositionResponse.rejected(designation, "Invalid instant: " + at));
        }

        try {
            final var position = solver.solvePosition(comet.get().getElements(), instant);
            return ResponseEntity.ok(new OrbitPositionResponse(comet.get().getDesignation(), instant, position,
                    frameConverter.toEquatorial(position, instant), "OK", null));
        } catch (final NonConvergenceException e) {
            log.error("Position of [{}] at {} unavailable: {}", designation, instant, e.getMessage());
            return ResponseEntity.unprocessableEntity()
                    .body(OrbitPositionResponse.rejected(comet.get().getDesignation(), "Position unavailable: " + e.getMessage()));
        }
    }
}
