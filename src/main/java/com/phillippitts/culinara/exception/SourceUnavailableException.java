package com.phillippitts.culinara.exception;

/**
 * Thrown by a candidate source (embedding model, vector store, web search) when it cannot serve
 * a request. Callers recover by treating the source as empty.
 */
public class SourceUnavailableException extends CulinaraException {

    private final String sourceName;

    public SourceUnavailableException(String message, String sourceName) {
        super(message + " (source: " + sourceName + ")");
        this.sourceName = sourceName;
    }

    public SourceUnavailableException(String message, String sourceName, Throwable cause) {
        super(message + " (source: " + sourceName + ")", cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
