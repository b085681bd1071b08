package com.phillippitts.culinara.service.source;

import com.phillippitts.culinara.exception.StoreUnavailableException;

import java.util.List;

/**
 * Similarity search over the curated recipe store.
 */
public interface VectorStore {

    /**
     * Finds the records most similar to the given query vector.
     *
     * @param vector    query embedding
     * @param topK      maximum number of records to return
     * @param threshold minimum similarity a record must reach
     * @return records sorted by similarity descending; empty is a valid outcome
     * @throws StoreUnavailableException if the store cannot be queried
     */
    List<ScoredRecord> search(float[] vector, int topK, double threshold);
}
