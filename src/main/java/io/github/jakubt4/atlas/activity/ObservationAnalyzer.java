package io.github.jakubt4.atlas.activity;

import io.github.jakubt4.atlas.model.LightCurvePoint;
import io.github.jakubt4.atlas.model.Observation;
import io.github.jakubt4.atlas.model.ObservationSet;
import io.github.jakubt4.atlas.model.ObservationStatistics;
import io.github.jakubt4.atlas.orbit.TrackedComet;
import org.hipparchus.stat.descriptive.moment.Mean;
import org.hipparchus.stat.descriptive.moment.StandardDeviation;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Summaries over a batch of observations: the daily light curve and headline statistics.
 */
@Component
public class ObservationAnalyzer {

    public ObservationSet summarize(final TrackedComet comet, final List<Observation> observations, final Instant now) {
        return new ObservationSet(comet.getDesignation(), observations, lightCurve(observations),
                statistics(observations, comet.getElements().perihelionEpoch(), now), now);
    }

    /**
     * Mean magnitude per UTC day with the population standard deviation, oldest day first.
     * Reports without a magnitude are left out.
     */
    public List<LightCurvePoint> lightCurve(final List<Observation> observations) {
        final Map<LocalDate, double[]> byDay = withMagnitude(observations).stream()
                .collect(Collectors.groupingBy(
                        o -> LocalDate.ofInstant(o.date(), ZoneOffset.UTC),
                        TreeMap::new,
                        Collectors.collectingAndThen(Collectors.toList(),
                                day -> day.stream().mapToDouble(Observation::magnitude).toArray())));

        return byDay.entrySet().stream()
                .map(day -> new LightCurvePoint(
                        day.getKey(),
                        roundToHundredth(new Mean().evaluate(day.getValue())),
                        roundToHundredth(new StandardDeviation(false).evaluate(day.getValue())),
                        day.getValue().length))
                .toList();
    }

    public ObservationStatistics statistics(final List<Observation> observations,
                                            final Instant perihelion,
                                            final Instant now) {
        final var daysUntilPerihelion = Duration.between(now, perihelion).toDays();
        final var usable = withMagnitude(observations);
        if (usable.isEmpty()) {
            return new ObservationStatistics(observations == null ? 0 : observations.size(), 0, null, null,
                    daysUntilPerihelion);
        }
        final var magnitudes = usable.stream().mapToDouble(Observation::magnitude).toArray();
        final var observers = usable.stream()
                .map(Observation::observerId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        return new ObservationStatistics(
                observations.size(),
                (int) observers,
                usable.stream().mapToDouble(Observation::magnitude).min().orElseThrow(),
                roundToHundredth(new Mean().evaluate(magnitudes)),
                daysUntilPerihelion);
    }

    /**
     * Brightness change between the last two light-curve days in mag/day; positive means fading.
     */
    public double brightnessChangeRate(final List<LightCurvePoint> lightCurve) {
        if (lightCurve == null || lightCurve.size() < 2) {
            return 0.0;
        }
        final var previous = lightCurve.get(lightCurve.size() - 2);
        final var last = lightCurve.get(lightCurve.size() - 1);
        final var days = ChronoUnit.DAYS.between(previous.date(), last.date());
        return days > 0 ? (last.magnitude() - previous.magnitude()) / days : 0.0;
    }

    private static List<Observation> withMagnitude(final List<Observation> observations) {
        if (observations == null) {
            return List.of();
        }
        return observations.stream()
                .filter(o -> o != null && o.date() != null && o.magnitude() != null)
                .toList();
    }

    private static double roundToHundredth(final double value) {
        return FastMath.round(value * 100.0) / 100.0;
    }
}
