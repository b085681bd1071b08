package com.phillippitts.culinara.exception;

/** Thrown when the web search provider cannot be reached. */
public class SearchUnavailableException extends SourceUnavailableException {

    public static final String SOURCE = "web-search";

    public SearchUnavailableException(String message) {
        super(message, SOURCE);
    }

    public SearchUnavailableException(String message, Throwable cause) {
        super(message, SOURCE, cause);
    }
}
