package com.phillippitts.culinara.service.orchestration;

import com.phillippitts.culinara.config.properties.QueryProperties;
import com.phillippitts.culinara.domain.Candidate;
import com.phillippitts.culinara.domain.Provenance;
import com.phillippitts.culinara.exception.SourceUnavailableException;
import com.phillippitts.culinara.service.rank.KeywordMatcher;
import com.phillippitts.culinara.service.source.EmbeddingClient;
import com.phillippitts.culinara.service.source.ScoredRecord;
import com.phillippitts.culinara.service.source.VectorStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Database stage: embeds the query, searches the vector store and converts records into
 * {@code FROM_DATABASE} candidates.
 *
 * <p>An unavailable embedding provider or store yields an unavailable, empty result. Scores are
 * similarity plus the keyword boost, clamped to [0,1].
 */
public class DatabaseCandidateSource {
    private static final Logger LOG = LogManager.getLogger(DatabaseCandidateSource.class);

    private final EmbeddingClient embeddingClient;
    private final VectorStore vectorStore;
    private final QueryProperties props;
    private final KeywordMatcher keywordMatcher;
    private final QueryMetricsPublisher metrics;

    /**
     * Candidates from the store.
     *
     * @param candidates candidates in store order
     * @param available  false when the embedding provider or store could not be reached
     */
    public record Result(List<Candidate> candidates, boolean available) {
        static final Result UNAVAILABLE = new Result(List.of(), false);
    }

    public DatabaseCandidateSource(EmbeddingClient embeddingClient,
                                   VectorStore vectorStore,
                                   QueryProperties props,
                                   KeywordMatcher keywordMatcher,
                                   QueryMetricsPublisher metrics) {
        this.embeddingClient = Objects.requireNonNull(embeddingClient);
        this.vectorStore = Objects.requireNonNull(vectorStore);
        this.props = Objects.requireNonNull(props);
        this.keywordMatcher = keywordMatcher == null ? new KeywordMatcher() : keywordMatcher;
        this.metrics = metrics == null ? QueryMetricsPublisher.NOOP : metrics;
    }

    public Result search(String text) {
        List<ScoredRecord> records;
        try {
            float[] vector = embeddingClient.embed(text);
            records = vectorStore.search(vector, props.getTopK(), props.getSimilarityThreshold());
        } catch (SourceUnavailableException e) {
            LOG.warn("Recipe store unavailable, continuing without it: {}", e.getMessage());
            metrics.recordSourceUnavailable(e.getSourceName());
            return Result.UNAVAILABLE;
        }
        metrics.recordSourceUsed("database");

        List<Candidate> candidates = new ArrayList<>();
        int rejected = 0;
        for (ScoredRecord record : records == null ? List.<ScoredRecord>of() : records) {
            if (record == null || record.title() == null || record.title().isBlank()) {
                continue;
            }
            double boost = 0.0;
            if (props.isRequireIngredientMatch()) {
                KeywordMatcher.Match match = keywordMatcher.evaluate(text, record.title(), record.ingredients());
                if (!match.valid()) {
                    rejected++;
                    continue;
                }
                boost = match.boost();
            }
            String sourceId = record.id() != null ? record.id() : Objects.toString(record.url(), record.title());
            candidates.add(Candidate.of(record.title(), record.ingredients(), record.instructions(), sourceId,
                    record.facts(), clamp(record.similarity() + boost), Provenance.FROM_DATABASE));
        }
        LOG.debug("Recipe store returned {} record(s), {} kept, {} rejected by ingredient check",
                records == null ? 0 : records.size(), candidates.size(), rejected);
        return new Result(List.copyOf(candidates), true);
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
