package io.github.jakubt4.atlas.activity;

import java.time.Instant;
import java.util.List;

/**
 * Current activity of the tracked comet together with its daily history.
 */
public record ActivityReport(ActivityResult current,
                             List<DailyActivity> timeline,
                             ActivityTimeline.Trend trend,
                             Instant generatedAt) {
}
