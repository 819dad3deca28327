package org.gopti.planner.exception.provider;

import lombok.Getter;

/**
 * Travel-time provider failure. Always recovered by the caller.
 */
@Getter
public abstract class ProviderException extends RuntimeException {
    private final String provider;

    protected ProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    protected ProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
