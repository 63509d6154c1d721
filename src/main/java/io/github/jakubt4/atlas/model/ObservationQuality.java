package io.github.jakubt4.atlas.model;

public enum ObservationQuality {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    /**
     * Grades a report by its magnitude uncertainty; {@code null} when none was reported.
     */
    public static ObservationQuality fromUncertainty(final Double uncertainty) {
        if (uncertainty == null || uncertainty.isNaN()) {
            return null;
        }
        if (uncertainty < 0.1) {
            return EXCELLENT;
        }
        if (uncertainty < 0.2) {
            return GOOD;
        }
        if (uncertainty < 0.4) {
            return FAIR;
        }
        return POOR;
    }
}
