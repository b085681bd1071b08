package com.phillippitts.culinara.domain;

import java.util.Objects;

/**
 * A URL scheduled for scraping.
 *
 * @param url   page URL
 * @param depth 0 for seed URLs, 1 for links discovered on a collection page
 */
public record ScrapeTask(String url, int depth) {

    /** Collection pages are expanded at most one level deep. */
    public static final int MAX_DEPTH = 1;

    public ScrapeTask {
        Objects.requireNonNull(url, "url must not be null");
        if (depth < 0 || depth > MAX_DEPTH) {
            throw new IllegalArgumentException("depth must be in [0," + MAX_DEPTH + "], got: " + depth);
        }
    }

    public static ScrapeTask seed(String url) {
        return new ScrapeTask(url, 0);
    }

    public boolean canExpand() {
        return depth < MAX_DEPTH;
    }

    public ScrapeTask child(String childUrl) {
        return new ScrapeTask(childUrl, depth + 1);
    }
}
