package io.github.jakubt4.atlas.controller;

import io.github.jakubt4.atlas.dto.HealthResponse;
import io.github.jakubt4.atlas.model.ProviderCallState;
import io.github.jakubt4.atlas.model.SourceHealth;
import io.github.jakubt4.atlas.source.SourceHealthRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Collection;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    private final SourceHealthRegistry healthRegistry;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<HealthResponse> getHealth() {
        final var sources = healthRegistry.snapshot();
        return ResponseEntity.ok(new HealthResponse(overall(sources.values()), sources, clock.instant()));
    }

    static String overall(final Collection<SourceHealth> sources) {
        if (sources.stream().allMatch(s -> s.state() == ProviderCallState.NOT_ATTEMPTED)) {
            return "UNKNOWN";
        }
        final var active = sources.stream().filter(SourceHealth::active).count();
        if (active == sources.size()) {
            return "UP";
        }
        return active == 0 ? "DOWN" : "DEGRADED";
    }
}
