package io.github.jakubt4.atlas.client;

import io.github.jakubt4.atlas.model.LiveCoordinates;
import io.github.jakubt4.atlas.source.DataSource;
import io.github.jakubt4.atlas.source.LiveCoordinatesProvider;
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
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Scrapes apparent RA/Dec, Earth distance and the latest observed magnitude from the
 * TheSkyLive info page of 3I/ATLAS.
 */
@Slf4j
@Service
public class TheSkyLiveClient implements LiveCoordinatesProvider {

    static final String INFO_PATH = "/c2025n1-info";

    private static final Pattern RA_MARKUP = Pattern.compile("<number class=\"raApparent\">([^<]+)</number>", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEC_MARKUP = Pattern.compile("<number class=\"decApparent\">([^<]+)</number>", Pattern.CASE_INSENSITIVE);
    private static final Pattern DISTANCE_MARKUP = Pattern.compile("<number class=\"distanceAU\">([^<]+)</number>", Pattern.CASE_INSENSITIVE);
    private static final Pattern MAGNITUDE_MARKUP = Pattern.compile("latest observed magnitude[^>]*is <number>([^<]+)</number>", Pattern.CASE_INSENSITIVE);

    private static final Pattern HMS = Pattern.compile("(\\d+)h\\s*(\\d+)m\\s*(\\d+(?:\\.\\d+)?)s");
    private static final Pattern DMS = Pattern.compile("([+-]?)(\\d+)°\\s*(\\d+)'\\s*(\\d+(?:\\.\\d+)?)\"");

    private final RestClient restClient;
    private final Clock clock;

    public TheSkyLiveClient(final RestClient.Builder restClientBuilder,
                            @Value("${theskylive.base-url}") final String baseUrl,
                            final Clock clock) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .build();
        this.clock = clock;
    }

    @Override
    @Retryable(retryFor = HttpServerErrorException.class, notRecoverable = ProviderUnavailableException.class,
               maxAttempts = 2, backoff = @Backoff(delay = 500))
    public LiveCoordinates fetchLiveCoordinates() {
        final var html = restClient.get()
                .uri(INFO_PATH)
                .accept(MediaType.TEXT_HTML)
                .retrieve()
                .body(String.class);

        final var coordinates = parse(html, clock.instant());
        log.info("[THESKYLIVE] ra={} dec={} delta={} AU", coordinates.ra(), coordinates.dec(),
                coordinates.geocentricDistance());
        return coordinates;
    }

    @Recover
    public LiveCoordinates recoverFetchLiveCoordinates(final RestClientException e) {
        throw new ProviderUnavailableException(DataSource.THESKYLIVE, "TheSkyLive unavailable: " + e.getMessage(), e);
    }

    static LiveCoordinates parse(final String html, final Instant retrievedAt) {
        if (html == null || html.isBlank()) {
            throw new ProviderUnavailableException(DataSource.THESKYLIVE, "Empty response");
        }
        final var ra = extract(RA_MARKUP, html).map(TheSkyLiveClient::parseRightAscension).orElse(0.0);
        final var dec = extract(DEC_MARKUP, html).map(TheSkyLiveClient::parseDeclination).orElse(0.0);
        if (ra == 0.0 && dec == 0.0) {
            throw new ProviderUnavailableException(DataSource.THESKYLIVE, "No coordinates on page");
        }
        final var distance = extract(DISTANCE_MARKUP, html).map(TheSkyLiveClient::parseNumber).orElse(null);
        if (distance == null || distance <= 0.0) {
            throw new ProviderUnavailableException(DataSource.THESKYLIVE, "No Earth distance on page");
        }
        final var magnitude = extract(MAGNITUDE_MARKUP, html).map(TheSkyLiveClient::parseNumber).orElse(null);
        return new LiveCoordinates(ra, dec, distance, magnitude, retrievedAt);
    }

    /**
     * "14h 22m 5.3s" to degrees; 0 if the text does not match.
     */
    static double parseRightAscension(final String text) {
        final var matcher = HMS.matcher(text);
        if (!matcher.find()) {
            return 0.0;
        }
        final var hours = Integer.parseInt(matcher.group(1))
                + Integer.parseInt(matcher.group(2)) / 60.0
                + Double.parseDouble(matcher.group(3)) / 3600.0;
        return hours * 15.0;
    }

    /**
     * "-12° 34' 56"" to degrees; 0 if the text does not match.
     */
    static double parseDeclination(final String text) {
        final var matcher = DMS.matcher(text);
        if (!matcher.find()) {
            return 0.0;
        }
        final var sign = "-".equals(matcher.group(1)) ? -1.0 : 1.0;
        return sign * (Integer.parseInt(matcher.group(2))
                + Integer.parseInt(matcher.group(3)) / 60.0
                + Double.parseDouble(matcher.group(4)) / 3600.0);
    }

    private static Optional<String> extract(final Pattern pattern, final String html) {
        final var matcher = pattern.matcher(html);
        return matcher.find() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
    }

    private static Double parseNumber(final String text) {
        try {
            return Double.parseDouble(text.replace(",", "").trim());
        } catch (NumberFormatException e) {
            log.debug("Unparseable number '{}' on TheSkyLive page", text);
            return null;
        }
    }
}
