package io.github.jakubt4.atlas.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * @param providerTimeout budget of one provider call, retries included; a late answer is dropped
 * @param executorPoolSize threads shared by provider calls and cache disk I/O
 */
@ConfigurationProperties(prefix = "tracker.aggregation")
public record AggregationProperties(@DefaultValue("10s") Duration providerTimeout,
                                    @DefaultValue("8") int executorPoolSize) {
}
