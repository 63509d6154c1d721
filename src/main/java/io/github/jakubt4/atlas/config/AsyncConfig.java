package io.github.jakubt4.atlas.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AsyncConfig {

    /**
     * Bounded pool for provider calls and cache disk I/O. Request threads only wait on futures.
     */
    @Bean(name = "trackerExecutor")
    ThreadPoolTaskExecutor trackerExecutor(final AggregationProperties properties) {
        final var executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("tracker-");
        executor.setCorePoolSize(properties.executorPoolSize());
        executor.setMaxPoolSize(properties.executorPoolSize());
        executor.setQueueCapacity(100);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
