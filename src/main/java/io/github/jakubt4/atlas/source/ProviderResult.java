package io.github.jakubt4.atlas.source;

import java.util.Optional;

/**
 * Terminal outcome of one provider call.
 */
public sealed interface ProviderResult<T> permits ProviderResult.Succeeded, ProviderResult.Failed {

    record Succeeded<T>(T data) implements ProviderResult<T> {
    }

    record Failed<T>(String reason) implements ProviderResult<T> {
    }

    static <T> ProviderResult<T> succeeded(final T data) {
        return new Succeeded<>(data);
    }

    static <T> ProviderResult<T> failed(final String reason) {
        return new Failed<>(reason);
    }

    default Optional<T> value() {
        if (this instanceof Succeeded<T> succeeded) {
            return Optional.ofNullable(succeeded.data());
        }
        return Optional.empty();
    }
}
