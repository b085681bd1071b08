package com.phillippitts.culinara.service.scrape;

import com.phillippitts.culinara.domain.Candidate;

import java.util.List;

/**
 * Web fallback stage: turns seed URLs into scored {@code FROM_WEB} candidates.
 *
 * <p>Implementations bound the number of fetches in flight, bound each fetch and the whole stage
 * by a timeout, and tolerate individual page failures: a stage with N seeds of which M fail
 * yields candidates for the N - M that succeeded.
 */
public interface ScrapeCoordinator {

    /**
     * Scrapes the given seed URLs.
     *
     * @param queryText query text used to score pages
     * @param seedUrls  normalized URLs, in search order
     * @return candidates in discovery order; empty when nothing usable was found
     */
    List<Candidate> scrape(String queryText, List<String> seedUrls);

    /**
     * Runs web search for the query and scrapes the results.
     *
     * @param queryText query text
     * @return candidates in discovery order; empty when search is unavailable or finds nothing
     */
    List<Candidate> searchAndScrape(String queryText);
}
