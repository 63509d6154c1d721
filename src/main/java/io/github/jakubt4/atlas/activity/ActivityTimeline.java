package io.github.jakubt4.atlas.activity;

import io.github.jakubt4.atlas.model.Observation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds a per-day activity series: reports are grouped by UTC day, each day is reduced to its
 * median magnitude and classified against the heliocentric distance at noon of that day.
 */
@Component
@RequiredArgsConstructor
public class ActivityTimeline {

    public enum Trend { INCREASING, DECREASING, STABLE }

    private static final int MIN_DAYS_FOR_TREND = 4;
    private static final double TREND_THRESHOLD = 10.0;

    private final ActivityClassifier classifier;

    public List<DailyActivity> build(final List<Observation> observations,
                                     final Function<Instant, Double> heliocentricDistanceAt) {
        if (observations == null || observations.isEmpty()) {
            return List.of();
        }
        final Map<LocalDate, List<Observation>> byDay = observations.stream()
                .filter(Objects::nonNull)
                .filter(o -> o.date() != null)
                .collect(Collectors.groupingBy(
                        o -> LocalDate.ofInstant(o.date(), ZoneOffset.UTC),
                        TreeMap::new,
                        Collectors.toList()));

        final var days = new ArrayList<DailyActivity>(byDay.size());
        byDay.forEach((day, reports) -> {
            final var noon = day.atTime(LocalTime.NOON).toInstant(ZoneOffset.UTC);
            final var result = classifier.classifyDay(reports, heliocentricDistanceAt.apply(noon));
            final var countConfidence = Math.min(1.0, reports.size() / 3.0);
            final var dataQuality = result.level() == ActivityLevel.INSUFFICIENT_DATA ? 0.0 : 1.0;
            days.add(new DailyActivity(day, result, reports.size(), countConfidence * 0.7 + dataQuality * 0.3));
        });
        return List.copyOf(days);
    }

    /**
     * Compares the mean activity index of the later half of the series with the earlier half.
     */
    public static Trend trend(final List<DailyActivity> days) {
        if (days.size() < MIN_DAYS_FOR_TREND) {
            return Trend.STABLE;
        }
        final var half = days.size() / 2;
        final var diff = meanIndex(days.subList(half, days.size())) - meanIndex(days.subList(0, half));
        if (Math.abs(diff) < TREND_THRESHOLD) {
            return Trend.STABLE;
        }
        return diff > 0 ? Trend.INCREASING : Trend.DECREASING;
    }

    private static double meanIndex(final List<DailyActivity> days) {
        return days.stream().mapToInt(d -> d.activity().level().getIndex()).average().orElse(0.0);
    }
}
