package com.phillippitts.culinara.exception;

/**
 * Thrown when a recipe query violates the request contract (missing text, oversized text,
 * nonsensical preferences). This is the only failure the orchestrator propagates to its caller.
 */
public class InvalidQueryException extends CulinaraException {

    private final String reason;

    public InvalidQueryException(String reason) {
        super("Invalid query: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
