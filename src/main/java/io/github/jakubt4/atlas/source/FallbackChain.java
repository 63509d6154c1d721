package io.github.jakubt4.atlas.source;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Ordered list of candidate sources for one merged field. Candidates are evaluated lazily in
 * order and the first one that yields a value wins.
 */
@Slf4j
final class FallbackChain<T> {

    record Resolved<T>(T value, String source) {
    }

    private record Candidate<T>(String source, Supplier<Optional<T>> value) {
    }

    private final String slot;
    private final List<Candidate<T>> candidates = new ArrayList<>();

    private FallbackChain(final String slot) {
        this.slot = slot;
    }

    static <T> FallbackChain<T> forSlot(final String slot) {
        return new FallbackChain<>(slot);
    }

    FallbackChain<T> then(final String source, final Supplier<Optional<T>> value) {
        candidates.add(new Candidate<>(source, value));
        return this;
    }

    /**
     * @return the first available value, or {@code orElse} attributed to {@code "none"}
     */
    Resolved<T> resolve(final T orElse) {
        for (final var candidate : candidates) {
            final var value = candidate.value().get();
            if (value.isPresent()) {
                log.debug("Resolved {} from {}", slot, candidate.source());
                return new Resolved<>(value.get(), candidate.source());
            }
        }
        log.debug("No source for {}", slot);
        return new Resolved<>(orElse, "none");
    }
}
