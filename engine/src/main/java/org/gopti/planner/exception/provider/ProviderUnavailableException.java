package org.gopti.planner.exception.provider;

public class ProviderUnavailableException extends ProviderException {

    public ProviderUnavailableException(String provider, String message) {
        super(provider, message);
    }

    public ProviderUnavailableException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }
}
