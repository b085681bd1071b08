package com.phillippitts.culinara.service.orchestration;

import com.phillippitts.culinara.domain.Query;
import com.phillippitts.culinara.domain.QueryResponse;
import com.phillippitts.culinara.exception.InvalidQueryException;

/**
 * Answers natural-language recipe queries.
 *
 * <p>The pipeline:
 * <ol>
 *   <li>Validates the query and consults the response cache</li>
 *   <li>Embeds the text and searches the recipe store</li>
 *   <li>Falls back to web search and scraping when too few diet-compatible store results exist</li>
 *   <li>Merges, filters and ranks the candidates</li>
 *   <li>Generates a summary and trivia facts through the provider fallback chain</li>
 * </ol>
 *
 * <p><b>Error Handling:</b> source outages, page failures and provider failures all degrade the
 * response instead of failing it. Only an invalid query is reported to the caller.
 *
 * <p><b>Latency:</b> a soft deadline flags slow responses as degraded and emits a
 * {@link com.phillippitts.culinara.service.orchestration.event.SlowQueryEvent}; it never aborts
 * work in progress.
 */
public interface QueryOrchestrator {

    /**
     * Answers a recipe query.
     *
     * @param query the query
     * @return a structurally valid response, never null
     * @throws InvalidQueryException if the query is malformed
     */
    QueryResponse answer(Query query);
}
