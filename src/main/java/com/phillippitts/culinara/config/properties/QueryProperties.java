package com.phillippitts.culinara.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for query orchestration.
 */
@Validated
@ConfigurationProperties(prefix = "culinara.query")
public class QueryProperties {

    /** Number of records requested from the vector store. */
    @Min(1)
    private final int topK;

    /** Minimum similarity a database record must reach to count as a candidate. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double similarityThreshold;

    /**
     * Diet-compatible database candidates needed to skip the web fallback.
     */
    @Min(1)
    private final int minDatabaseCandidates;

    @Min(1)
    private final int resultCap;

    /**
     * Soft per-request deadline. Overrunning it flags the response as degraded; it never aborts.
     */
    @Min(1)
    private final long softDeadlineMs;

    @Min(1)
    private final int maxQueryLength;

    @Min(0)
    private final int maxFacts;

    /**
     * When true, database records that do not mention an ingredient named in the query (or that
     * mention a conflicting one) are discarded.
     */
    private final boolean requireIngredientMatch;

    @ConstructorBinding
    public QueryProperties(Integer topK,
                           Double similarityThreshold,
                           Integer minDatabaseCandidates,
                           Integer resultCap,
                           Long softDeadlineMs,
                           Integer maxQueryLength,
                           Integer maxFacts,
                           Boolean requireIngredientMatch) {
        this.topK = topK == null ? 10 : topK;
        this.similarityThreshold = similarityThreshold == null ? 0.45 : similarityThreshold;
        this.minDatabaseCandidates = minDatabaseCandidates == null ? 1 : minDatabaseCandidates;
        this.resultCap = resultCap == null ? 5 : resultCap;
        this.softDeadlineMs = softDeadlineMs == null ? 8_000L : softDeadlineMs;
        this.maxQueryLength = maxQueryLength == null ? 1000 : maxQueryLength;
        this.maxFacts = maxFacts == null ? 3 : maxFacts;
        this.requireIngredientMatch = requireIngredientMatch == null || requireIngredientMatch;
    }

    /**
     * Properties with every default applied.
     */
    public static QueryProperties defaults() {
        return new QueryProperties(null, null, null, null, null, null, null, null);
    }

    public int getTopK() {
        return topK;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public int getMinDatabaseCandidates() {
        return minDatabaseCandidates;
    }

    public int getResultCap() {
        return resultCap;
    }

    public long getSoftDeadlineMs() {
        return softDeadlineMs;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public int getMaxFacts() {
        return maxFacts;
    }

    public boolean isRequireIngredientMatch() {
        return requireIngredientMatch;
    }
}
