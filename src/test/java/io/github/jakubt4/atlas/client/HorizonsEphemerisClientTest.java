package io.github.jakubt4.atlas.client;

import io.github.jakubt4.atlas.source.ProviderUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HorizonsEphemerisClientTest {

    private static final String BASE_URL = "http://localhost:8092";
    private static final Instant NOW = Instant.parse("2025-10-01T06:00:00Z");

    private static final String VECTORS = """
            *******************************************************************************
            Ephemeris / API_USER Wed Oct  1 06:00:00 2025 Pasadena, USA      / Horizons
            *******************************************************************************
            Target body name: ATLAS (C/2025 N1)               {source: JPL#27}
            Center body name: Sun (10)                        {source: DE441}
            $$SOE
            2460949.500000000 = A.D. 2025-Oct-01 00:00:00.0000 TDB
             X = 1.234567890123456E+00 Y =-1.045678901234567E+00 Z = 8.765432109876543E-02
             VX= 1.234567890123456E-02 VY= 2.345678901234567E-02 VZ=-1.234567890123456E-03
             LT= 9.381234567890123E-03 RG= 1.624356789012345E+00 RR=-5.123456789012345E-03
            2460950.500000000 = A.D. 2025-Oct-02 00:00:00.0000 TDB
             X = 9.000000000000000E+00 Y = 9.000000000000000E+00 Z = 9.000000000000000E+00
             VX= 9.000000000000000E-02 VY= 9.000000000000000E-02 VZ= 9.000000000000000E-02
            $$EOE
            """;

    private HorizonsEphemerisClient client;
    private MockRestServiceServer mockServer;

    @BeforeEach
    void setUp() {
        final var restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.bindTo(restTemplate).build();

        final var builder = RestClient.builder()
                .requestFactory(restTemplate.getRequestFactory());

        client = new HorizonsEphemerisClient(builder, BASE_URL, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void fetchEphemerisRequestsHeliocentricVectorsForToday() {
        mockServer.expect(requestTo(startsWith(BASE_URL + "/api/horizons.api")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("EPHEM_TYPE", "VECTORS"))
                .andExpect(queryParam("START_TIME", "2025-10-01"))
                .andExpect(queryParam("STOP_TIME", "2025-10-02"))
                .andExpect(queryParam("REF_PLANE", "ECLIPTIC"))
                .andExpect(queryParam("OUT_UNITS", "AU-D"))
                .andRespond(withSuccess(VECTORS, MediaType.TEXT_PLAIN));

        final var snapshot = client.fetchEphemeris();

        mockServer.verify();
        assertThat(snapshot.epoch()).isEqualTo(Instant.parse("2025-10-01T00:00:00Z"));
        assertThat(snapshot.position().x()).isEqualTo(1.234567890123456);
        assertThat(snapshot.position().y()).isEqualTo(-1.045678901234567);
        assertThat(snapshot.position().z()).isEqualTo(0.08765432109876543);
        assertThat(snapshot.velocity().vz()).isEqualTo(-0.001234567890123456);
        assertThat(snapshot.magnitude()).isNull();
    }

    @Test
    void fetchEphemerisThrowsOnServerError() {
        mockServer.expect(requestTo(startsWith(BASE_URL + "/api/horizons.api")))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchEphemeris())
                .isInstanceOf(HttpServerErrorException.class);
    }

    @Test
    void errorTextIsReportedAsUnavailable() {
        assertThatThrownBy(() -> HorizonsEphemerisClient.parse("ERROR: no matches found", NOW))
                .isInstanceOf(ProviderUnavailableException.class);
        assertThatThrownBy(() -> HorizonsEphemerisClient.parse("No ephemeris for target", NOW))
                .isInstanceOf(ProviderUnavailableException.class);
    }

    @Test
    void missingDataBlockIsReported() {
        assertThatThrownBy(() -> HorizonsEphemerisClient.parse("Target body name: ATLAS", NOW))
                .isInstanceOf(ProviderUnavailableException.class)
                .hasMessageContaining("$$SOE");
    }

    @Test
    void incompleteVectorIsReported() {
        final var body = """
                $$SOE
                2460949.500000000 = A.D. 2025-Oct-01 00:00:00.0000 TDB
                 X = 1.2E+00 Y =-1.0E+00 Z = 8.7E-02
                $$EOE
                """;

        assertThatThrownBy(() -> HorizonsEphemerisClient.parse(body, NOW))
                .isInstanceOf(ProviderUnavailableException.class)
                .hasMessageContaining("Incomplete");
    }

    @Test
    void degenerateVectorIsRejected() {
        final var body = """
                $$SOE
                 X = 0.0E+00 Y = 0.0E+00 Z = 0.0E+00
                 VX= 1.0E-02 VY= 1.0E-02 VZ= 1.0E-02
                $$EOE
                """;

        assertThatThrownBy(() -> HorizonsEphemerisClient.parse(body, NOW))
                .isInstanceOf(ProviderUnavailableException.class)
                .hasMessageContaining("Degenerate");
    }

    @Test
    void missingEpochFallsBackToRequestTime() {
        final var body = """
                $$SOE
                 X = 1.0E+00 Y = 1.0E+00 Z = 0.0E+00
                 VX= 1.0E-02 VY= 1.0E-02 VZ= 0.0E+00
                $$EOE
                """;

        assertThat(HorizonsEphemerisClient.parse(body, NOW).epoch()).isEqualTo(NOW);
    }
}
