package org.gopti.planner.exception.provider;

public class ProviderRateLimitedException extends ProviderException {

    public ProviderRateLimitedException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }
}
