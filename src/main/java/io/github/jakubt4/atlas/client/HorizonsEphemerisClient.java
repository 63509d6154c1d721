package io.github.jakubt4.atlas.client;

import io.github.jakubt4.atlas.model.EphemerisSnapshot;
import io.github.jakubt4.atlas.orbit.Position3D;
import io.github.jakubt4.atlas.orbit.TrackedComet;
import io.github.jakubt4.atlas.orbit.Velocity3D;
import io.github.jakubt4.atlas.source.DataSource;
import io.github.jakubt4.atlas.source.EphemerisProvider;
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
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Client of the JPL Horizons API. Requests heliocentric ecliptic state vectors (Sun centre,
 * AU and days) and reads the first record of the {@code $$SOE}/{@code $$EOE} block.
 */
@Slf4j
@Service
public class HorizonsEphemerisClient implements EphemerisProvider {

    static final String HORIZONS_PATH = "/api/horizons.api";

    private static final Pattern EPOCH = Pattern.compile("A\\.D\\.\\s+(\\d{4}-[A-Za-z]{3}-\\d{2}\\s+\\d{2}:\\d{2}:\\d{2})");
    private static final Pattern X = component("X");
    private static final Pattern Y = component("Y");
    private static final Pattern Z = component("Z");
    private static final Pattern VX = component("VX");
    private static final Pattern VY = component("VY");
    private static final Pattern VZ = component("VZ");
    private static final DateTimeFormatter EPOCH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MMM-dd HH:mm:ss", Locale.ENGLISH);

    private final RestClient restClient;
    private final Clock clock;

    public HorizonsEphemerisClient(final RestClient.Builder restClientBuilder,
                                   @Value("${horizons.base-url}") final String baseUrl,
                                   final Clock clock) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .build();
        this.clock = clock;
    }

    @Override
    @Retryable(retryFor = HttpServerErrorException.class, notRecoverable = ProviderUnavailableException.class,
               maxAttempts = 2, backoff = @Backoff(delay = 500))
    public EphemerisSnapshot fetchEphemeris() {
        final var today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        final var body = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(HORIZONS_PATH)
                        .queryParam("format", "text")
                        .queryParam("COMMAND", "'" + TrackedComet.ATLAS_3I.getDesignation() + "'")
                        .queryParam("EPHEM_TYPE", "VECTORS")
                        .queryParam("START_TIME", today.toString())
                        .queryParam("STOP_TIME", today.plusDays(1).toString())
                        .queryParam("STEP_SIZE", "1d")
                        .queryParam("CENTER", "500@10")
                        .queryParam("REF_PLANE", "ECLIPTIC")
                        .queryParam("OUT_UNITS", "AU-D")
                        .build())
                .accept(MediaType.TEXT_PLAIN, MediaType.ALL)
                .retrieve()
                .body(String.class);

        final var snapshot = parse(body, clock.instant());
        log.info("[HORIZONS] state vector at {}, r={} AU", snapshot.epoch(), snapshot.position().norm());
        return snapshot;
    }

    @Recover
    public EphemerisSnapshot recoverFetchEphemeris(final RestClientException e) {
        throw new ProviderUnavailableException(DataSource.JPL_HORIZONS, "Horizons unavailable: " + e.getMessage(), e);
    }

    static EphemerisSnapshot parse(final String body, final Instant fallbackEpoch) {
        if (body == null || body.isBlank()) {
            throw new ProviderUnavailableException(DataSource.JPL_HORIZONS, "Empty response");
        }
        if (body.contains("ERROR") || body.contains("No ephemeris")) {
            throw new ProviderUnavailableException(DataSource.JPL_HORIZONS, "Horizons returned an error or no data");
        }
        final var start = body.indexOf("$$SOE");
        final var end = body.indexOf("$$EOE");
        if (start < 0 || end < start) {
            throw new ProviderUnavailableException(DataSource.JPL_HORIZONS, "No $$SOE/$$EOE block in response");
        }

        Instant epoch = null;
        Position3D position = null;
        Velocity3D velocity = null;
        for (final var line : body.substring(start + 5, end).split("\\R")) {
            if (epoch == null) {
                final var epochMatch = EPOCH.matcher(line);
                if (epochMatch.find()) {
                    epoch = parseEpoch(epochMatch.group(1));
                    continue;
                }
            }
            if (position == null && line.contains("X =") && line.contains("Y =") && line.contains("Z =")) {
                position = new Position3D(value(X, line), value(Y, line), value(Z, line));
            } else if (velocity == null && line.contains("VX=") && line.contains("VY=") && line.contains("VZ=")) {
                velocity = new Velocity3D(value(VX, line), value(VY, line), value(VZ, line));
            }
            if (position != null && velocity != null) {
                break;
            }
        }

        if (position == null || velocity == null) {
            throw new ProviderUnavailableException(DataSource.JPL_HORIZONS, "Incomplete state vector in response");
        }
        if (position.norm() < 1.0e-3) {
            throw new ProviderUnavailableException(DataSource.JPL_HORIZONS, "Degenerate position vector");
        }
        return new EphemerisSnapshot(position, velocity, null, epoch != null ? epoch : fallbackEpoch);
    }

    private static Pattern component(final String name) {
        return Pattern.compile("\\b" + name + "\\s*=\\s*(\\S+)");
    }

    private static double value(final Pattern pattern, final String line) {
        final Matcher matcher = pattern.matcher(line);
        if (!matcher.find()) {
            throw new ProviderUnavailableException(DataSource.JPL_HORIZONS, "Missing " + pattern.pattern() + " in: " + line.trim());
        }
        try {
            return Double.parseDouble(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new ProviderUnavailableException(DataSource.JPL_HORIZONS, "Bad number in: " + line.trim(), e);
        }
    }

    private static Instant parseEpoch(final String text) {
        try {
            return LocalDateTime.parse(text.replaceAll("\\s+", " "), EPOCH_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Horizons epoch '{}': {}", text, e.getMessage());
            return null;
        }
    }
}
