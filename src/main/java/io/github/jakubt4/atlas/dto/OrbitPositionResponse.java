package io.github.jakubt4.atlas.dto;

import io.github.jakubt4.atlas.orbit.EquatorialPosition;
import io.github.jakubt4.atlas.orbit.Position3D;

import java.time.Instant;

public record OrbitPositionResponse(String designation,
                                    Instant at,
                                    Position3D heliocentric,
                                    EquatorialPosition skyPosition,
                                    String status,
                                    String message) {

    public static OrbitPositionResponse rejected(final String designation, final String message) {
        return new OrbitPositionResponse(designation, null, null, null, "REJECTED", message);
    }
}
