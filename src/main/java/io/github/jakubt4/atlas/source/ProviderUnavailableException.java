package io.github.jakubt4.atlas.source;

import lombok.Getter;

/**
 * An upstream provider could not deliver usable data: transport error, error status or a payload
 * that failed to parse.
 */
@Getter
public class ProviderUnavailableException extends RuntimeException {

    private final DataSource source;

    public ProviderUnavailableException(final DataSource source, final String message) {
        super(message);
        this.source = source;
    }

    public ProviderUnavailableException(final DataSource source, final String message, final Throwable cause) {
        super(message, cause);
        this.source = source;
    }
}
