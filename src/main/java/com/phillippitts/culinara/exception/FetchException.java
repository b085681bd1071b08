package com.phillippitts.culinara.exception;

/**
 * Thrown (or used to complete a future exceptionally) when a recipe page cannot be fetched or
 * parsed. An expected, recoverable outcome: the scrape stage drops the page and carries on.
 */
public class FetchException extends CulinaraException {

    private final String url;

    public FetchException(String message, String url) {
        super(message + " (url: " + url + ")");
        this.url = url;
    }

    public FetchException(String message, String url, Throwable cause) {
        super(message + " (url: " + url + ")", cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
