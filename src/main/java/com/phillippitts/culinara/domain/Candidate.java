package com.phillippitts.culinara.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable recipe candidate produced by a source stage (vector store or web scrape).
 *
 * <p>Candidates are never mutated after creation; {@link #withRank(int)} returns a copy carrying
 * the final rank assigned by the ranker.
 *
 * @param title        recipe title (must not be null)
 * @param ingredients  ingredient lines in source order
 * @param instructions instruction steps in source order
 * @param sourceId     database id or page URL
 * @param facts        structured facts (times, servings, nutrition)
 * @param score        similarity or relevance score between 0.0 and 1.0 (higher is better)
 * @param provenance   which source produced this candidate
 * @param rank         1-based final rank, or 0 while unranked
 */
public record Candidate(
        String title,
        List<String> ingredients,
        List<String> instructions,
        String sourceId,
        RecipeFacts facts,
        double score,
        Provenance provenance,
        int rank
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if score is outside [0,1] or rank is negative
     * @throws NullPointerException if title, sourceId or provenance is null
     */
    public Candidate {
        Objects.requireNonNull(title, "Candidate title must not be null");
        Objects.requireNonNull(sourceId, "Candidate sourceId must not be null");
        Objects.requireNonNull(provenance, "Candidate provenance must not be null");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got: " + score);
        }
        if (rank < 0) {
            throw new IllegalArgumentException("Rank must not be negative, got: " + rank);
        }
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
        facts = facts == null ? RecipeFacts.EMPTY : facts;
    }

    /**
     * Creates an unranked candidate.
     */
    public static Candidate of(String title, List<String> ingredients, List<String> instructions,
                               String sourceId, RecipeFacts facts, double score, Provenance provenance) {
        return new Candidate(title, ingredients, instructions, sourceId, facts, score, provenance, 0);
    }

    /**
     * Returns a copy of this candidate carrying the given final rank.
     */
    public Candidate withRank(int newRank) {
        return new Candidate(title, ingredients, instructions, sourceId, facts, score, provenance, newRank);
    }

    public boolean fromDatabase() {
        return provenance == Provenance.FROM_DATABASE;
    }
}
