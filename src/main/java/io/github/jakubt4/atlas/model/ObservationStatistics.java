package io.github.jakubt4.atlas.model;

public record ObservationStatistics(int totalObservations,
                                    int activeObservers,
                                    Double brightestMagnitude,
                                    Double averageMagnitude,
                                    long daysUntilPerihelion) {
}
