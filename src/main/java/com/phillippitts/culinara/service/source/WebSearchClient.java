package com.phillippitts.culinara.service.source;

import com.phillippitts.culinara.exception.SearchUnavailableException;

import java.util.List;

/**
 * Web search used to find candidate recipe pages when the recipe store has no good match.
 * Implementations can scrape a search engine or call a proper API.
 */
public interface WebSearchClient {

    /**
     * Search the web and return candidate page URLs.
     *
     * @param text  free-text query
     * @param limit maximum number of URLs to return
     * @return candidate URLs in search-engine order; empty is a valid outcome
     * @throws SearchUnavailableException if the search fails
     */
    List<String> search(String text, int limit);
}
