package io.github.jakubt4.atlas.activity;

import java.time.LocalDate;

/**
 * Activity of one UTC day of observations.
 *
 * @param confidence 0-1, grows with the number of reports and drops to 0.7 or less without a usable result
 */
public record DailyActivity(LocalDate date, ActivityResult activity, int observationCount, double confidence) {
}
