package com.phillippitts.culinara.service.source;

import com.phillippitts.culinara.exception.EmbeddingUnavailableException;

/**
 * Turns query text into a fixed-length embedding vector. Implementations call a remote
 * embedding API; the orchestrator only consumes the vector.
 */
public interface EmbeddingClient {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding vector
     * @throws EmbeddingUnavailableException if the embedding provider cannot be reached
     */
    float[] embed(String text);
}
