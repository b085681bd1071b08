package com.phillippitts.culinara.exception;

/** Thrown when a text generation attempt exceeds its per-attempt timeout. */
public class ProviderTimeoutException extends ProviderException {

    private final long timeoutMs;

    public ProviderTimeoutException(String providerId, long timeoutMs) {
        super("Generation timed out after " + timeoutMs + "ms", providerId);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
