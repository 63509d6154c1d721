package io.github.jakubt4.atlas.model;

import java.time.LocalDate;

/**
 * Daily mean magnitude with its population standard deviation.
 */
public record LightCurvePoint(LocalDate date, double magnitude, double stdDev, int count) {
}
