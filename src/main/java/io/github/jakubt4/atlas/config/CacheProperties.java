package io.github.jakubt4.atlas.config;

import io.github.jakubt4.atlas.cache.CachePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Cache policies per dataset. Raising {@code schemaVersion} discards every entry written before.
 */
@ConfigurationProperties(prefix = "tracker.cache")
public record CacheProperties(@DefaultValue(".cache") Path directory,
                              @DefaultValue("true") boolean persistent,
                              @DefaultValue("1") int schemaVersion,
                              @DefaultValue("5m") Duration stateMaxAge,
                              @DefaultValue("48h") Duration stateStaleWindow,
                              @DefaultValue("5m") Duration observationsMaxAge,
                              @DefaultValue("48h") Duration observationsStaleWindow) {

    public CachePolicy statePolicy() {
        return new CachePolicy(stateMaxAge, stateStaleWindow, schemaVersion);
    }

    public CachePolicy observationsPolicy() {
        return new CachePolicy(observationsMaxAge, observationsStaleWindow, schemaVersion);
    }
}
