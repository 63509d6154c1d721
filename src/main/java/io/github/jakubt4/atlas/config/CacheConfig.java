package io.github.jakubt4.atlas.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.atlas.cache.DiskStore;
import io.github.jakubt4.atlas.cache.FileSystemDiskStore;
import io.github.jakubt4.atlas.cache.StalenessAwareCache;
import io.github.jakubt4.atlas.model.EnhancedCometState;
import io.github.jakubt4.atlas.model.ObservationSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    DiskStore diskStore(final CacheProperties properties) {
        log.info("Persistent cache directory: {}", properties.directory().toAbsolutePath());
        return new FileSystemDiskStore(properties.directory());
    }

    @Bean
    StalenessAwareCache<EnhancedCometState> stateCache(final CacheProperties properties,
                                                       final DiskStore diskStore,
                                                       final ObjectMapper objectMapper,
                                                       @Qualifier("trackerExecutor") final Executor executor,
                                                       final Clock clock) {
        return new StalenessAwareCache<>("state", properties.statePolicy(), EnhancedCometState.class,
                properties.persistent() ? diskStore : null, objectMapper, executor, clock);
    }

    @Bean
    StalenessAwareCache<ObservationSet> observationCache(final CacheProperties properties,
                                                         final DiskStore diskStore,
                                                         final ObjectMapper objectMapper,
                                                         @Qualifier("trackerExecutor") final Executor executor,
                                                         final Clock clock) {
        return new StalenessAwareCache<>("observations", properties.observationsPolicy(), ObservationSet.class,
                properties.persistent() ? diskStore : null, objectMapper, executor, clock);
    }
}
