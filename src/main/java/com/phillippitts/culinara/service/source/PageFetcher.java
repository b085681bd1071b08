package com.phillippitts.culinara.service.source;

import com.phillippitts.culinara.exception.FetchException;
import com.phillippitts.culinara.exception.FetchTimeoutException;

import java.util.concurrent.CompletableFuture;

/**
 * Fetches and parses a recipe page. Site-specific parsing lives behind this interface.
 *
 * <p>Fetching is asynchronous so a timed-out fetch can be abandoned without holding a scrape
 * worker. Implementations should honour {@link CompletableFuture#cancel(boolean)} where they can.
 */
public interface PageFetcher {

    /**
     * Fetches and parses the page at the given URL.
     *
     * @param url page URL
     * @return future completed with the parsed page, or exceptionally with
     *         {@link FetchTimeoutException} or {@link FetchException}
     */
    CompletableFuture<FetchedPage> fetch(String url);
}
