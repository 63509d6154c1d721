package io.github.jakubt4.atlas.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    private static final String USER_AGENT = "atlas-tracker/0.1 (comet dashboard)";

    @Bean
    RestClientCustomizer restClientCustomizer(@Value("${tracker.http.connect-timeout:5s}") final Duration connectTimeout,
                                              @Value("${tracker.http.read-timeout:8s}") final Duration readTimeout) {
        return builder -> {
            final var requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(connectTimeout);
            requestFactory.setReadTimeout(readTimeout);
            builder.requestFactory(requestFactory)
                    .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT);
        };
    }
}
