package io.github.jakubt4.atlas.activity;

import io.github.jakubt4.atlas.model.Observation;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.KthSelector;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Classifies cometary activity from the excess brightness over an inactive-nucleus model.
 *
 * <p>{@code expected = H + 5·log10(r) + n·log10(r)} with H = 15.5 and n = 4.0, calibrated for
 * 3I/ATLAS. The distance term uses the heliocentric distance r in both places, where a
 * textbook model would use the geocentric distance for the first one.
 *
 * <p>Thresholds on {@code delta = expected - current}, applied to the unrounded delta:
 * <pre>
 *   delta &lt;= 0.5          LOW
 *   0.5 &lt; delta &lt;= 1.0    MODERATE
 *   1.0 &lt; delta &lt;= 2.0    HIGH
 *   delta &gt; 2.0           EXTREME
 * </pre>
 *
 * <p>Never throws and never returns NaN: any unusable input yields {@link ActivityLevel#INSUFFICIENT_DATA}.
 */
@Component
public class ActivityClassifier {

    static final double ABSOLUTE_MAGNITUDE = 15.5;
    static final double ACTIVITY_COEFFICIENT = 4.0;

    private static final double DEFAULT_CORRELATION = 0.5;
    private static final double MIN_CORRELATION = 0.3;
    private static final double MAX_CORRELATION = 0.9;

    public ActivityResult classify(final Double currentMagnitude, final Double heliocentricDistance) {
        if (!isUsable(currentMagnitude) || !isUsable(heliocentricDistance) || heliocentricDistance <= 0.0) {
            return ActivityResult.insufficientData();
        }
        final var r = heliocentricDistance.doubleValue();
        final var expected = ABSOLUTE_MAGNITUDE + 5.0 * FastMath.log10(r) + ACTIVITY_COEFFICIENT * FastMath.log10(r);
        final var delta = expected - currentMagnitude;
        if (!Double.isFinite(delta)) {
            return ActivityResult.insufficientData();
        }
        return new ActivityResult(levelFor(delta), currentMagnitude, roundToTenth(expected), roundToTenth(delta), r);
    }

    /**
     * Classifies the most recent observation of the list.
     */
    public ActivityResult classify(final List<Observation> observations, final Double heliocentricDistance) {
        if (!allMagnitudesPresent(observations)) {
            return ActivityResult.insufficientData();
        }
        final var latest = observations.stream()
                .filter(o -> o.date() != null)
                .max(Comparator.comparing(Observation::date))
                .orElse(observations.get(observations.size() - 1));
        return classify(latest.magnitude(), heliocentricDistance);
    }

    /**
     * Classifies a day of reports by their median magnitude, which damps single outliers. With an
     * even count the upper of the two middle values is taken, not their mean.
     */
    public ActivityResult classifyDay(final List<Observation> dayObservations, final Double heliocentricDistance) {
        if (!allMagnitudesPresent(dayObservations)) {
            return ActivityResult.insufficientData();
        }
        final var magnitudes = dayObservations.stream()
                .mapToDouble(Observation::magnitude)
                .toArray();
        return classify(upperMedian(magnitudes), heliocentricDistance);
    }

    /**
     * Inverse-square response of brightness to heliocentric distance, clamped to [0.3, 0.9];
     * 0.5 when the distance is unknown.
     */
    public double activityCorrelation(final Double heliocentricDistance) {
        if (!isUsable(heliocentricDistance) || heliocentricDistance <= 0.0) {
            return DEFAULT_CORRELATION;
        }
        final var inverseSquare = 1.0 / (heliocentricDistance * heliocentricDistance);
        return FastMath.max(MIN_CORRELATION, FastMath.min(MAX_CORRELATION, inverseSquare));
    }

    static double upperMedian(final double[] values) {
        return new KthSelector().select(values.clone(), null, values.length / 2);
    }

    static ActivityLevel levelFor(final double brightnessDelta) {
        if (brightnessDelta > 2.0) {
            return ActivityLevel.EXTREME;
        }
        if (brightnessDelta > 1.0) {
            return ActivityLevel.HIGH;
        }
        if (brightnessDelta > 0.5) {
            return ActivityLevel.MODERATE;
        }
        return ActivityLevel.LOW;
    }

    private static boolean allMagnitudesPresent(final List<Observation> observations) {
        return observations != null
                && !observations.isEmpty()
                && observations.stream().allMatch(o -> o != null && isUsable(o.magnitude()));
    }

    private static boolean isUsable(final Double value) {
        return Objects.nonNull(value) && Double.isFinite(value);
    }

    private static double roundToTenth(final double value) {
        return FastMath.round(value * 10.0) / 10.0;
    }
}
