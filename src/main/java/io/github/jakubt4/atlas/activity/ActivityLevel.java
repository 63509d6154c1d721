package io.github.jakubt4.atlas.activity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ActivityLevel {
    LOW(20, "Low activity - minimal cometary activity"),
    MODERATE(40, "Moderate activity - noticeable brightness changes"),
    HIGH(70, "High activity - significant brightening and coma development"),
    EXTREME(90, "Extreme activity - dramatic outbursts and rapid evolution"),
    INSUFFICIENT_DATA(0, "Insufficient data for activity calculation");

    /** 0-100 index used by the activity charts. */
    private final int index;
    private final String description;
}
