package io.github.jakubt4.atlas.service;

import io.github.jakubt4.atlas.orbit.EquatorialPosition;
import io.github.jakubt4.atlas.orbit.FrameConverter;
import io.github.jakubt4.atlas.orbit.NonConvergenceException;
import io.github.jakubt4.atlas.orbit.OrbitalSolver;
import io.github.jakubt4.atlas.orbit.Position3D;
import io.github.jakubt4.atlas.orbit.TrackedComet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Analytic positions of every tracked comet. No provider is involved.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CometCatalogService {

    /**
     * @param heliocentric   {@code null} when the solver did not converge
     * @param skyPosition    {@code null} when the solver did not converge
     * @param speedKmPerSecond heliocentric speed, {@code null} when the solver did not converge
     */
    public record CometView(String designation,
                            String name,
                            boolean hyperbolic,
                            Instant perihelionDate,
                            Position3D heliocentric,
                            EquatorialPosition skyPosition,
                            Double speedKmPerSecond,
                            String status) {
    }

    private final OrbitalSolver solver;
    private final FrameConverter frameConverter;

    public List<CometView> describeAll(final Instant at) {
        return Arrays.stream(TrackedComet.values())
                .map(comet -> describe(comet, at))
                .toList();
    }

    public CometView describe(final TrackedComet comet, final Instant at) {
        final var elements = comet.getElements();
        try {
            final var position = solver.solvePosition(elements, at);
            return new CometView(comet.getDesignation(), comet.getDisplayName(), elements.isHyperbolic(),
                    elements.perihelionEpoch(), position, frameConverter.toEquatorial(position, at),
                    solver.heliocentricSpeed(elements, at), "OK");
        } catch (final NonConvergenceException e) {
            log.warn("[POSITION_UNAVAILABLE] {}: {}", comet.getDisplayName(), e.getMessage());
            return new CometView(comet.getDesignation(), comet.getDisplayName(), elements.isHyperbolic(),
                    elements.perihelionEpoch(), null, null, null, "position unavailable");
        }
    }
}
