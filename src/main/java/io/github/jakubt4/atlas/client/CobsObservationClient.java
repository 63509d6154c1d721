package io.github.jakubt4.atlas.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.atlas.model.Observation;
import io.github.jakubt4.atlas.model.ObservationQuality;
import io.github.jakubt4.atlas.orbit.TrackedComet;
import io.github.jakubt4.atlas.source.DataSource;
import io.github.jakubt4.atlas.source.ObservationProvider;
import io.github.jakubt4.atlas.source.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Client of the COBS comet observation database ({@code obs_list.api}, JSON format).
 *
 * <p>Reports are normalised here: magnitudes outside [5, 20] and reports dated in the future
 * or more than two years back are dropped, the observer is identified by the lower-cased ICQ
 * code and quality is graded from the reported magnitude error. The result is sorted newest first.
 */
@Slf4j
@Service
public class CobsObservationClient implements ObservationProvider {

    static final String OBS_LIST_PATH = "/api/obs_list.api";
    static final String FROM_DATE = "2024-01-01";
    private static final double MIN_MAGNITUDE = 5.0;
    private static final double MAX_MAGNITUDE = 20.0;

    private static final Map<String, String> DESIGNATION_ALIASES = Map.of(
            "3I/ATLAS", "3I",
            "C/2025 N1", "3I");

    private static final DateTimeFormatter OBS_DATE = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral(' ').append(DateTimeFormatter.ISO_LOCAL_TIME).optionalEnd()
            .optionalStart().appendLiteral('T').append(DateTimeFormatter.ISO_LOCAL_TIME).optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .toFormatter(Locale.ROOT);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CobsObservationClient(final RestClient.Builder restClientBuilder,
                                 @Value("${cobs.base-url}") final String baseUrl,
                                 final ObjectMapper objectMapper,
                                 final Clock clock) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .build();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    @Retryable(retryFor = HttpServerErrorException.class, notRecoverable = ProviderUnavailableException.class,
               maxAttempts = 2, backoff = @Backoff(delay = 500))
    public List<Observation> fetchObservations(final String designation) {
        final var cobsDesignation = normalizeDesignation(designation);
        final var body = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(OBS_LIST_PATH)
                        .queryParam("des", cobsDesignation)
                        .queryParam("from_date", FROM_DATE)
                        .queryParam("format", "json")
                        .queryParam("page", "1")
                        .build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(String.class);

        final var observations = parse(body, clock.instant());
        if (observations.isEmpty()) {
            throw new ProviderUnavailableException(DataSource.COBS,
                    "No valid observations for designation " + cobsDesignation);
        }
        log.info("[COBS] {} observations for {}", observations.size(), cobsDesignation);
        return observations;
    }

    @Recover
    public List<Observation> recoverFetchObservations(final RestClientException e, final String designation) {
        throw new ProviderUnavailableException(DataSource.COBS,
                "COBS unavailable for " + designation + ": " + e.getMessage(), e);
    }

    static String normalizeDesignation(final String designation) {
        if (designation == null || designation.isBlank()) {
            throw new IllegalArgumentException("designation is required");
        }
        final var trimmed = designation.trim();
        final var alias = DESIGNATION_ALIASES.get(trimmed.toUpperCase(Locale.ROOT));
        if (alias != null) {
            return alias;
        }
        return TrackedComet.resolve(trimmed).map(TrackedComet::getCobsDesignation).orElse(trimmed);
    }

    List<Observation> parse(final String body, final Instant now) {
        if (body == null || body.isBlank()) {
            throw new ProviderUnavailableException(DataSource.COBS, "Empty response");
        }
        final JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException(DataSource.COBS, "Malformed JSON: " + e.getOriginalMessage(), e);
        }
        final var code = root.path("code").asText("");
        if (!code.isEmpty() && !"200".equals(code)) {
            throw new ProviderUnavailableException(DataSource.COBS,
                    "COBS error " + code + ": " + root.path("message").asText("unknown error"));
        }

        final var oldest = LocalDateTime.ofInstant(now, ZoneOffset.UTC).minusYears(2).toInstant(ZoneOffset.UTC);
        final var observations = new ArrayList<Observation>();
        var rejected = 0;
        for (final var node : root.path("objects")) {
            final var observation = toObservation(node, oldest, now);
            if (observation.isPresent()) {
                observations.add(observation.get());
            } else {
                rejected++;
            }
        }
        if (rejected > 0) {
            log.debug("[COBS] rejected {} reports during normalisation", rejected);
        }
        observations.sort(Comparator.comparing(Observation::date).reversed());
        return observations;
    }

    private static Optional<Observation> toObservation(final JsonNode node, final Instant oldest, final Instant now) {
        final var magnitude = number(node.path("magnitude"));
        final var date = date(node.path("obs_date").asText(null));
        if (magnitude == null || date == null || node.path("observer").isMissingNode()) {
            return Optional.empty();
        }
        if (magnitude < MIN_MAGNITUDE || magnitude > MAX_MAGNITUDE) {
            return Optional.empty();
        }
        if (date.isAfter(now) || date.isBefore(oldest)) {
            return Optional.empty();
        }
        final var icq = node.path("observer").path("icq_name").asText("");
        return Optional.of(new Observation(
                date,
                magnitude,
                icq.isBlank() ? "unknown" : icq.toLowerCase(Locale.ROOT),
                node.path("obs_method").path("key").asText("V"),
                number(node.path("instrument_aperture")),
                number(node.path("coma_diameter")),
                ObservationQuality.fromUncertainty(number(node.path("magnitude_error")))));
    }

    private static Double number(final JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (!node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        try {
            final var value = Double.parseDouble(node.asText().trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            log.debug("Unparseable COBS number '{}'", node.asText());
            return null;
        }
    }

    private static Instant date(final String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        final var trimmed = text.trim();
        try {
            if (trimmed.endsWith("Z")) {
                return Instant.parse(trimmed);
            }
            return LocalDateTime.parse(trimmed, OBS_DATE).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable COBS date '{}': {}", trimmed, e.getMessage());
            return null;
        }
    }
}
