package com.phillippitts.culinara.exception;

/** Thrown when a page fetch exceeds its per-task timeout. */
public class FetchTimeoutException extends FetchException {

    private final long timeoutMs;

    public FetchTimeoutException(String url, long timeoutMs) {
        super("Fetch timed out after " + timeoutMs + "ms", url);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
