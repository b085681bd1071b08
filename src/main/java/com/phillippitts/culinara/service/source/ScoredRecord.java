package com.phillippitts.culinara.service.source;

import com.phillippitts.culinara.domain.RecipeFacts;

import java.util.List;

/**
 * A recipe record returned by the vector store together with its similarity to the query.
 *
 * @param id           store identifier
 * @param title        recipe title
 * @param ingredients  ingredient lines
 * @param instructions instruction steps
 * @param url          original recipe URL, or null
 * @param facts        structured facts, or null
 * @param similarity   cosine similarity to the query vector (higher is more similar)
 */
public record ScoredRecord(
        String id,
        String title,
        List<String> ingredients,
        List<String> instructions,
        String url,
        RecipeFacts facts,
        double similarity
) {

    public ScoredRecord {
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
    }
}
