package io.github.jakubt4.atlas.model;

import io.github.jakubt4.atlas.activity.ActivityResult;
import io.github.jakubt4.atlas.orbit.EquatorialPosition;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Merged view of the tracked comet built from every provider that answered. Fields that no
 * provider could supply are filled from the analytic model, so a state is always complete.
 *
 * @param jplEphemeris current sky position, resolved through the ephemeris fallback chain
 * @param sourceStatus health per provider, keyed {@code cobs}, {@code jpl_horizons}, {@code theskylive}
 */
public record EnhancedCometState(CometSummary comet,
                                 ObservationStatistics stats,
                                 OrbitalMechanics orbitalMechanics,
                                 JplEphemeris jplEphemeris,
                                 BrightnessEnhanced brightnessEnhanced,
                                 ActivityResult activity,
                                 Map<String, SourceHealth> sourceStatus,
                                 Instant generatedAt) {

    public EnhancedCometState {
        sourceStatus = sourceStatus == null ? Map.of() : Map.copyOf(sourceStatus);
    }

    public boolean anySourceActive() {
        return sourceStatus.values().stream().anyMatch(SourceHealth::active);
    }

    public EnhancedCometState withSourceStatus(final Map<String, SourceHealth> status) {
        return new EnhancedCometState(comet, stats, orbitalMechanics, jplEphemeris, brightnessEnhanced, activity,
                status, generatedAt);
    }

    /**
     * @param currentPosition geocentric equatorial position with both distances, {@code null} only if
     *                        the analytic solver failed as well
     * @param positionSource  which provider the position came from: {@code jpl_horizons},
     *                        {@code theskylive}, {@code analytic} or {@code none}
     */
    public record JplEphemeris(EquatorialPosition currentPosition, String positionSource) {
    }

    public record BrightnessEnhanced(double visualMagnitude, BrightnessVelocity brightnessVelocity) {
    }

    /**
     * @param visualChangeRate    mag/day between the last two light-curve days, 0 with fewer than two
     * @param activityCorrelation inverse-square brightness response to distance, within [0.3, 0.9]
     */
    public record BrightnessVelocity(double visualChangeRate, double activityCorrelation) {
    }

    public record CometSummary(String name,
                               String designation,
                               double currentMagnitude,
                               String magnitudeSource,
                               Instant perihelionDate,
                               List<Observation> observations,
                               List<LightCurvePoint> lightCurve) {

        public CometSummary {
            observations = observations == null ? List.of() : List.copyOf(observations);
            lightCurve = lightCurve == null ? List.of() : List.copyOf(lightCurve);
        }
    }

    public record OrbitalMechanics(Velocities currentVelocity,
                                   Distances currentDistance,
                                   VelocityChanges velocityChanges,
                                   PositionAccuracy positionAccuracy) {
    }

    /**
     * @param heliocentric km/s
     * @param geocentric   km/s
     * @param angular      arcsec/day across the sky
     */
    public record Velocities(double heliocentric, double geocentric, double angular) {
    }

    /** Both in AU. */
    public record Distances(double heliocentric, double geocentric) {
    }

    /**
     * @param acceleration    solar gravitational acceleration, km/s²
     * @param directionChange turn of the velocity vector, degrees/day
     * @param trend7day       mean change of heliocentric speed over the last week, km/s per day
     */
    public record VelocityChanges(double acceleration, double directionChange, double trend7day) {
    }

    public record PositionAccuracy(double uncertaintyArcsec,
                                   Instant lastObservation,
                                   double predictionConfidence,
                                   String source) {
    }
}
