package io.github.jakubt4.atlas.source;

import io.github.jakubt4.atlas.activity.ActivityClassifier;
import io.github.jakubt4.atlas.activity.ObservationAnalyzer;
import io.github.jakubt4.atlas.model.EnhancedCometState;
import io.github.jakubt4.atlas.model.EnhancedCometState.BrightnessEnhanced;
import io.github.jakubt4.atlas.model.EnhancedCometState.BrightnessVelocity;
import io.github.jakubt4.atlas.model.EnhancedCometState.CometSummary;
import io.github.jakubt4.atlas.model.EnhancedCometState.Distances;
import io.github.jakubt4.atlas.model.EnhancedCometState.JplEphemeris;
import io.github.jakubt4.atlas.model.EnhancedCometState.OrbitalMechanics;
import io.github.jakubt4.atlas.model.EnhancedCometState.PositionAccuracy;
import io.github.jakubt4.atlas.model.EnhancedCometState.VelocityChanges;
import io.github.jakubt4.atlas.model.EnhancedCometState.Velocities;
import io.github.jakubt4.atlas.model.EphemerisSnapshot;
import io.github.jakubt4.atlas.model.LiveCoordinates;
import io.github.jakubt4.atlas.model.Observation;
import io.github.jakubt4.atlas.model.SourceHealth;
import io.github.jakubt4.atlas.orbit.EquatorialPosition;
import io.github.jakubt4.atlas.orbit.FrameConverter;
import io.github.jakubt4.atlas.orbit.NonConvergenceException;
import io.github.jakubt4.atlas.orbit.OrbitalKinematics;
import io.github.jakubt4.atlas.orbit.OrbitalSolver;
import io.github.jakubt4.atlas.orbit.TrackedComet;
import io.github.jakubt4.atlas.orbit.Velocity3D;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import static io.github.jakubt4.atlas.source.DataSource.COBS;
import static io.github.jakubt4.atlas.source.DataSource.JPL_HORIZONS;
import static io.github.jakubt4.atlas.source.DataSource.THESKYLIVE;

/**
 * Merges the three provider outcomes of one round into an {@link EnhancedCometState}.
 *
 * <p>Every field is resolved through its own fallback chain:
 * <pre>
 *   sky position, distances   jpl_horizons, theskylive, analytic
 *   heliocentric velocity     jpl_horizons, analytic (vis-viva)
 *   current magnitude         cobs (latest report), theskylive, jpl_horizons, 0
 * </pre>
 * The brightness block reuses the resolved magnitude, the light curve and the resolved
 * heliocentric distance.
 * The analytic model only needs the orbital elements, so a state can be built with every
 * provider down. Holds no state of its own.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateMerger {

    static final String ANALYTIC = "analytic";
    private static final int TREND_DAYS = 7;

    private final OrbitalSolver solver;
    private final FrameConverter frameConverter;
    private final OrbitalKinematics kinematics;
    private final ActivityClassifier classifier;
    private final ObservationAnalyzer analyzer;

    public EnhancedCometState merge(final TrackedComet comet,
                                    final ProviderResults results,
                                    final Map<String, SourceHealth> health,
                                    final Instant at) {
        final var elements = comet.getElements();
        final var ephemeris = results.ephemeris().value();
        final var live = results.liveCoordinates().value();
        final var observations = results.observations().value().orElse(List.of());

        final var sky = FallbackChain.<EquatorialPosition>forSlot("sky position")
                .then(JPL_HORIZONS.getKey(), () -> ephemeris.map(e -> frameConverter.toEquatorial(e.position(), e.epoch())))
                .then(THESKYLIVE.getKey(), () -> live.map(l -> fromLiveCoordinates(l, at)))
                .then(ANALYTIC, () -> analytic(() -> frameConverter.toEquatorial(solver.solvePosition(elements, at), at)))
                .resolve(null);

        final var velocity = FallbackChain.<Velocity3D>forSlot("velocity vector")
                .then(JPL_HORIZONS.getKey(), () -> ephemeris.map(EphemerisSnapshot::velocity))
                .then(ANALYTIC, () -> analytic(() -> kinematics.velocity(elements, at)))
                .resolve(null);

        final var heliocentricSpeed = FallbackChain.<Double>forSlot("heliocentric velocity")
                .then(JPL_HORIZONS.getKey(), () -> ephemeris.map(e -> e.velocity().kmPerSecond()))
                .then(ANALYTIC, () -> analytic(() -> solver.heliocentricSpeed(elements, at)))
                .resolve(0.0);

        final var magnitude = FallbackChain.<Double>forSlot("current magnitude")
                .then(COBS.getKey(), () -> latestMagnitude(observations))
                .then(THESKYLIVE.getKey(), () -> live.map(LiveCoordinates::magnitude))
                .then(JPL_HORIZONS.getKey(), () -> ephemeris.map(EphemerisSnapshot::magnitude))
                .resolve(0.0);

        final var position = sky.value();
        final var heliocentricDistance = position == null ? null : position.heliocentricDistance();
        final var activity = classifier.classify(
                "none".equals(magnitude.source()) ? null : magnitude.value(), heliocentricDistance);

        final var mechanics = new OrbitalMechanics(
                new Velocities(
                        heliocentricSpeed.value(),
                        velocity.value() == null ? 0.0 : kinematics.geocentricSpeed(velocity.value(), at),
                        analytic(() -> kinematics.angularRate(elements, at)).orElse(0.0)),
                position == null
                        ? new Distances(0.0, 0.0)
                        : new Distances(position.heliocentricDistance(), position.geocentricDistance()),
                new VelocityChanges(
                        heliocentricDistance == null || heliocentricDistance <= 0.0
                                ? 0.0 : kinematics.solarAcceleration(heliocentricDistance),
                        analytic(() -> kinematics.directionChange(elements, at)).orElse(0.0),
                        analytic(() -> kinematics.speedTrend(elements, at, TREND_DAYS)).orElse(0.0)),
                accuracyFor(sky.source(), ephemeris, live, at));

        final var lightCurve = analyzer.lightCurve(observations);
        final var summary = new CometSummary(
                comet.getDisplayName(),
                comet.getDesignation(),
                magnitude.value(),
                magnitude.source(),
                elements.perihelionEpoch(),
                observations,
                lightCurve);

        final var brightness = new BrightnessEnhanced(
                magnitude.value(),
                new BrightnessVelocity(
                        analyzer.brightnessChangeRate(lightCurve),
                        classifier.activityCorrelation(heliocentricDistance)));

        return new EnhancedCometState(
                summary,
                analyzer.statistics(observations, elements.perihelionEpoch(), at),
                mechanics,
                new JplEphemeris(position, sky.source()),
                brightness,
                activity,
                health,
                at);
    }

    private EquatorialPosition fromLiveCoordinates(final LiveCoordinates live, final Instant at) {
        final var heliocentric = frameConverter.toHeliocentric(live.ra(), live.dec(), live.geocentricDistance(), at);
        return new EquatorialPosition(live.ra(), live.dec(), heliocentric.norm(), live.geocentricDistance());
    }

    private static Optional<Double> latestMagnitude(final List<Observation> observations) {
        return observations.stream()
                .filter(o -> o.date() != null && o.magnitude() != null)
                .max(Comparator.comparing(Observation::date))
                .map(Observation::magnitude);
    }

    private static PositionAccuracy accuracyFor(final String source,
                                                final Optional<EphemerisSnapshot> ephemeris,
                                                final Optional<LiveCoordinates> live,
                                                final Instant at) {
        if (JPL_HORIZONS.getKey().equals(source)) {
            return new PositionAccuracy(1.0, ephemeris.map(EphemerisSnapshot::epoch).orElse(at), 0.95, source);
        }
        if (THESKYLIVE.getKey().equals(source)) {
            return new PositionAccuracy(3.0, live.map(LiveCoordinates::retrievedAt).orElse(at), 0.85, source);
        }
        return new PositionAccuracy(10.0, at, 0.7, source);
    }

    private static <T> Optional<T> analytic(final Supplier<T> computation) {
        try {
            return Optional.of(computation.get());
        } catch (final NonConvergenceException e) {
            log.warn("[POSITION_UNAVAILABLE] analytic model failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
