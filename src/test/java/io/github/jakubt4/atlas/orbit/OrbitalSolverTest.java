package io.github.jakubt4.atlas.orbit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OrbitalSolverTest {

    private static final Instant EPOCH = Instant.parse("2025-01-01T00:00:00Z");

    private final OrbitalSolver solver = new OrbitalSolver();

    @Test
    void hyperbolicOrbitIsAtPerihelionDistanceAtPerihelionEpoch() {
        final var elements = TrackedComet.ATLAS_3I.getElements();

        final var position = solver.solvePosition(elements, elements.perihelionEpoch());

        assertThat(position.norm()).isCloseTo(elements.perihelionDistance(), within(1.0e-9));
    }

    @Test
    void nearParabolicEllipseIsAtPerihelionDistanceAtPerihelionEpoch() {
        final var elements = TrackedComet.SWAN.getElements();

        final var position = solver.solvePosition(elements, elements.perihelionEpoch());

        assertThat(position.norm()).isCloseTo(elements.perihelionDistance(), within(1.0e-9));
    }

    @Test
    void ellipseReachesAphelionAfterHalfAPeriod() {
        final var elements = new OrbitalElements(0.5, 1.0, 0.0, 0.0, 0.0, EPOCH);
        final var a = elements.semiMajorAxis();
        final var periodDays = 2.0 * Math.PI * Math.sqrt(a * a * a / OrbitalConstants.SUN_MU_AU3_PER_DAY2);
        final var halfPeriod = Duration.ofSeconds(Math.round(periodDays * OrbitalConstants.SECONDS_PER_DAY / 2.0));

        final var position = solver.solvePosition(elements, EPOCH.plus(halfPeriod));

        assertThat(position.norm()).isCloseTo(a * (1.0 + 0.5), within(1.0e-6));
        assertThat(position.x()).isCloseTo(-3.0, within(1.0e-4));
    }

    @Test
    void parabolicOrbitUsesClosedFormSolution() {
        final var elements = new OrbitalElements(1.0, 0.8, 0.0, 0.0, 0.0, EPOCH);

        final var atPerihelion = solver.solvePosition(elements, EPOCH);
        final var later = solver.solvePosition(elements, EPOCH.plus(Duration.ofDays(30)));

        assertThat(atPerihelion.x()).isCloseTo(0.8, within(1.0e-12));
        assertThat(atPerihelion.y()).isCloseTo(0.0, within(1.0e-12));
        assertThat(later.norm()).isGreaterThan(0.8);
        assertThat(later.y()).isPositive();
    }

    @Test
    void argumentOfPeriapsisRotatesPerihelionWithinThePlane() {
        final var elements = new OrbitalElements(0.3, 1.0, 0.0, 0.0, 90.0, EPOCH);

        final var position = solver.solvePosition(elements, EPOCH);

        assertThat(position.x()).isCloseTo(0.0, within(1.0e-12));
        assertThat(position.y()).isCloseTo(1.0, within(1.0e-12));
        assertThat(position.z()).isCloseTo(0.0, within(1.0e-12));
    }

    @Test
    void inclinationLiftsOrbitOutOfTheEcliptic() {
        final var elements = new OrbitalElements(0.3, 1.0, 90.0, 0.0, 90.0, EPOCH);

        final var position = solver.solvePosition(elements, EPOCH);

        assertThat(position.z()).isCloseTo(1.0, within(1.0e-12));
    }

    @Test
    void distanceGrowsMonotonicallyAwayFromPerihelion() {
        final var elements = TrackedComet.ATLAS_3I.getElements();
        final var perihelion = elements.perihelionEpoch();

        var previous = 0.0;
        for (var days = 0; days <= 400; days += 20) {
            final var r = solver.solvePosition(elements, perihelion.plus(Duration.ofDays(days))).norm();
            assertThat(r).isGreaterThanOrEqualTo(previous);
            previous = r;
        }
    }

    @Test
    void distanceIsSymmetricAroundPerihelion() {
        final var elements = TrackedComet.ATLAS_3I.getElements();
        final var offset = Duration.ofDays(90);

        final var before = solver.solvePosition(elements, elements.perihelionEpoch().minus(offset)).norm();
        final var after = solver.solvePosition(elements, elements.perihelionEpoch().plus(offset)).norm();

        assertThat(before).isCloseTo(after, within(1.0e-9));
    }

    @Test
    void interstellarCometSpeedAtPerihelionMatchesVisViva() {
        final var elements = TrackedComet.ATLAS_3I.getElements();

        final var speed = solver.heliocentricSpeed(elements, elements.perihelionEpoch());

        assertThat(speed).isCloseTo(68.3, within(0.5));
    }

    @Test
    void iterationCapRaisesNonConvergence() {
        final var capped = new OrbitalSolver(1, 1.0e-15);
        final var elements = TrackedComet.ATLAS_3I.getElements();
        final var farFromPerihelion = elements.perihelionEpoch().plus(Duration.ofDays(3000));

        assertThatThrownBy(() -> capped.solvePosition(elements, farFromPerihelion))
                .isInstanceOf(NonConvergenceException.class)
                .hasMessageContaining("1 iterations");
    }

    @Test
    void solverStopsWhenStepFallsBelowTolerance() {
        final var e = 0.7;
        final var meanAnomaly = 1.2;

        final var anomaly = solver.solveElliptic(meanAnomaly, e);

        assertThat(anomaly - e * Math.sin(anomaly)).isCloseTo(meanAnomaly, within(1.0e-8));
    }

    @Test
    void hyperbolicSolverSatisfiesKeplerEquation() {
        final var e = 6.138559;
        final var meanAnomaly = -25.0;

        final var anomaly = solver.solveHyperbolic(meanAnomaly, e);

        assertThat(e * Math.sinh(anomaly) - anomaly).isCloseTo(meanAnomaly, within(1.0e-7));
    }

    @Test
    void rejectsInvalidElements() {
        assertThatThrownBy(() -> new OrbitalElements(-0.1, 1.0, 0, 0, 0, EPOCH))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OrbitalElements(0.5, 0.0, 0, 0, 0, EPOCH))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OrbitalElements(0.5, 1.0, 0, 0, 0, null))
                .isInstanceOf(NullPointerException.class);
    }
}
