package io.github.jakubt4.atlas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Atlas Tracker - data back end of the 3I/ATLAS comet dashboard.
 *
 * <p>Merges brightness reports from COBS, state vectors from JPL Horizons and live sky
 * coordinates from TheSkyLive into one enhanced comet state, filling gaps from an analytic
 * two-body model, and serves it from a staleness-aware cache behind a request deduplicator.
 *
 * @see io.github.jakubt4.atlas.source.SourceAggregationEngine
 * @see io.github.jakubt4.atlas.service.CometStateService
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry(proxyTargetClass = true)
@ConfigurationPropertiesScan
public class AtlasTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AtlasTrackerApplication.class, args);
    }
}
