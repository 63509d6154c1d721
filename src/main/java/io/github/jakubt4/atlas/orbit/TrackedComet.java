package io.github.jakubt4.atlas.orbit;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

/**
 * Catalog of bodies the dashboard follows, with their published heliocentric elements.
 *
 * <p>3I/ATLAS is the primary target; the companions are only propagated analytically.
 */
@Getter
@RequiredArgsConstructor
public enum TrackedComet {

    ATLAS_3I("C/2025 N1", "3I/ATLAS", "3I", new OrbitalElements(
            6.138559, 1.356320, 175.1131, 322.1574, 128.0127,
            Instant.parse("2025-10-29T11:35:31Z"))),

    SWAN("C/2025 R2", "SWAN", "C/2025 R2", new OrbitalElements(
            0.99936929, 0.50347198, 4.47016709, 335.67455839, 307.76903517,
            Instant.parse("2025-09-12T00:00:00Z"))),

    LEMMON("C/2025 A6", "Lemmon", "C/2025 A6", new OrbitalElements(
            0.99576389, 0.52918319, 143.63261677, 108.09789996, 132.99513300,
            Instant.parse("2025-11-08T00:00:00Z"))),

    K1_ATLAS("C/2025 K1", "K1 ATLAS", "C/2025 K1", new OrbitalElements(
            1.00153256, 0.33543043, 147.90080333, 97.48797247, 270.79200919,
            Instant.parse("2025-10-08T00:00:00Z"))),

    WIERZCHOS("C/2024 E1", "Wierzchos", "C/2024 E1", new OrbitalElements(
            1.00004883, 0.56584101, 75.23838445, 108.08299210, 243.63942205,
            Instant.parse("2026-01-20T00:00:00Z")));

    private final String designation;
    private final String displayName;
    private final String cobsDesignation;
    private final OrbitalElements elements;

    /**
     * Resolves a designation, display name or COBS alias, ignoring case and surrounding blanks.
     */
    public static Optional<TrackedComet> resolve(final String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        final var needle = name.trim();
        return Arrays.stream(values())
                .filter(c -> c.designation.equalsIgnoreCase(needle)
                        || c.displayName.equalsIgnoreCase(needle)
                        || c.cobsDesignation.equalsIgnoreCase(needle))
                .findFirst();
    }
}
