/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.culinara.exception.CulinaraException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.culinara.exception.InvalidQueryException} - Thrown when a
 *       query breaks the request contract; the only error surfaced to callers</li>
 *   <li>{@link com.phillippitts.culinara.exception.SourceUnavailableException} - A candidate
 *       source (embedding, vector store, web search) is down; recovered as an empty source</li>
 *   <li>{@link com.phillippitts.culinara.exception.FetchException} - A page fetch failed or
 *       timed out; the page is excluded from results</li>
 *   <li>{@link com.phillippitts.culinara.exception.ProviderException} - A text generation
 *       provider failed or timed out; the fallback chain moves on</li>
 * </ul>
 *
 * @see com.phillippitts.culinara.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.culinara.exception;
