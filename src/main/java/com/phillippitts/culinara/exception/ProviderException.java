package com.phillippitts.culinara.exception;

/**
 * Thrown when a text generation provider fails to produce output.
 * The fallback chain advances to the next provider.
 */
public class ProviderException extends CulinaraException {

    private final String providerId;

    public ProviderException(String message, String providerId) {
        super(message + " (provider: " + providerId + ")");
        this.providerId = providerId;
    }

    public ProviderException(String message, String providerId, Throwable cause) {
        super(message + " (provider: " + providerId + ")", cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
