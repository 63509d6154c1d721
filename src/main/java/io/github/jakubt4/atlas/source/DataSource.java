package io.github.jakubt4.atlas.source;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Upstream providers merged into the enhanced state. {@link #getKey()} is the name used in
 * health reports.
 */
@Getter
@RequiredArgsConstructor
public enum DataSource {

    COBS("cobs"),
    JPL_HORIZONS("jpl_horizons"),
    THESKYLIVE("theskylive");

    private final String key;
}
