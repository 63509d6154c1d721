package io.github.jakubt4.atlas.orbit;

import lombok.Getter;

/**
 * Kepler's equation did not converge within the iteration budget. The position for that
 * single request is unavailable; callers must not retry synchronously.
 */
@Getter
public class NonConvergenceException extends RuntimeException {

    private final double meanAnomaly;
    private final int iterations;

    public NonConvergenceException(final double meanAnomaly, final int iterations, final double residual) {
        super(String.format("Kepler solver did not converge: M=%.6f rad after %d iterations (residual %.3e)",
                meanAnomaly, iterations, residual));
        this.meanAnomaly = meanAnomaly;
        this.iterations = iterations;
    }
}
