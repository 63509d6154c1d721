package io.github.jakubt4.atlas.activity;

/**
 * Outcome of one activity classification. All numeric fields are zero when
 * {@code level == INSUFFICIENT_DATA}.
 */
public record ActivityResult(ActivityLevel level,
                             double currentMagnitude,
                             double expectedMagnitude,
                             double brightnessDelta,
                             double heliocentricDistance) {

    public static ActivityResult insufficientData() {
        return new ActivityResult(ActivityLevel.INSUFFICIENT_DATA, 0.0, 0.0, 0.0, 0.0);
    }
}
