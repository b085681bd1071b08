package com.phillippitts.culinara.exception;

/** Thrown when the embedding provider is down. */
public class EmbeddingUnavailableException extends SourceUnavailableException {

    public static final String SOURCE = "embedding";

    public EmbeddingUnavailableException(String message) {
        super(message, SOURCE);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, SOURCE, cause);
    }
}
