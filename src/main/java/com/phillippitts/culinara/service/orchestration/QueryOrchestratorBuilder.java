package com.phillippitts.culinara.service.orchestration;

import com.phillippitts.culinara.config.properties.QueryProperties;
import com.phillippitts.culinara.service.cache.ResponseCache;
import com.phillippitts.culinara.service.diet.DietaryFilter;
import com.phillippitts.culinara.service.generation.GenerationFallbackChain;
import com.phillippitts.culinara.service.generation.PromptBuilder;
import com.phillippitts.culinara.service.rank.CandidateRanker;
import com.phillippitts.culinara.service.rank.KeywordMatcher;
import com.phillippitts.culinara.service.scrape.ScrapeCoordinator;
import com.phillippitts.culinara.service.source.EmbeddingClient;
import com.phillippitts.culinara.service.source.VectorStore;
import com.phillippitts.culinara.service.validation.QueryValidator;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultQueryOrchestrator} to simplify construction with many dependencies.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * QueryOrchestrator orchestrator = QueryOrchestratorBuilder.builder()
 *     .embeddingClient(embeddings)
 *     .vectorStore(store)
 *     .scrapeCoordinator(scraper)
 *     .generationChain(chain)
 *     .generationExecutor(executor)
 *     .queryProperties(props)
 *     .publisher(publisher)
 *     .build();
 * }</pre>
 *
 * <p>Optional collaborators default to: a validator over the given properties, a fresh
 * {@link DietaryFilter}, a {@link CandidateRanker} capped at {@code result-cap}, a disabled
 * {@link ResponseCache} and {@link QueryMetricsPublisher#NOOP}.
 */
public final class QueryOrchestratorBuilder {

    // Required dependencies
    private EmbeddingClient embeddingClient;
    private VectorStore vectorStore;
    private ScrapeCoordinator scrapeCoordinator;
    private GenerationFallbackChain generationChain;
    private Executor generationExecutor;
    private QueryProperties queryProperties;
    private ApplicationEventPublisher publisher;

    // Optional dependencies
    private QueryValidator validator;
    private DietaryFilter dietaryFilter;
    private CandidateRanker ranker;
    private KeywordMatcher keywordMatcher;
    private PromptBuilder promptBuilder;
    private ResponseCache cache;
    private QueryMetricsPublisher metricsPublisher;

    private QueryOrchestratorBuilder() {
        // Private constructor - use builder() factory method
    }

    /**
     * Creates a new builder instance.
     *
     * @return new builder for DefaultQueryOrchestrator
     */
    public static QueryOrchestratorBuilder builder() {
        return new QueryOrchestratorBuilder();
    }

    public QueryOrchestratorBuilder embeddingClient(EmbeddingClient embeddingClient) {
        this.embeddingClient = embeddingClient;
        return this;
    }

    public QueryOrchestratorBuilder vectorStore(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
        return this;
    }

    public QueryOrchestratorBuilder scrapeCoordinator(ScrapeCoordinator scrapeCoordinator) {
        this.scrapeCoordinator = scrapeCoordinator;
        return this;
    }

    public QueryOrchestratorBuilder generationChain(GenerationFallbackChain generationChain) {
        this.generationChain = generationChain;
        return this;
    }

    /**
     * Sets the executor the summary and facts chains run on.
     *
     * @param generationExecutor executor (required)
     * @return this builder
     */
    public QueryOrchestratorBuilder generationExecutor(Executor generationExecutor) {
        this.generationExecutor = generationExecutor;
        return this;
    }

    public QueryOrchestratorBuilder queryProperties(QueryProperties queryProperties) {
        this.queryProperties = queryProperties;
        return this;
    }

    public QueryOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public QueryOrchestratorBuilder validator(QueryValidator validator) {
        this.validator = validator;
        return this;
    }

    public QueryOrchestratorBuilder dietaryFilter(DietaryFilter dietaryFilter) {
        this.dietaryFilter = dietaryFilter;
        return this;
    }

    public QueryOrchestratorBuilder ranker(CandidateRanker ranker) {
        this.ranker = ranker;
        return this;
    }

    public QueryOrchestratorBuilder keywordMatcher(KeywordMatcher keywordMatcher) {
        this.keywordMatcher = keywordMatcher;
        return this;
    }

    public QueryOrchestratorBuilder promptBuilder(PromptBuilder promptBuilder) {
        this.promptBuilder = promptBuilder;
        return this;
    }

    public QueryOrchestratorBuilder cache(ResponseCache cache) {
        this.cache = cache;
        return this;
    }

    public QueryOrchestratorBuilder metricsPublisher(QueryMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
        return this;
    }

    /**
     * Builds the orchestrator.
     *
     * @return configured orchestrator
     * @throws NullPointerException if any required dependency is null
     */
    public QueryOrchestrator build() {
        Objects.requireNonNull(embeddingClient, "embeddingClient is required");
        Objects.requireNonNull(vectorStore, "vectorStore is required");
        Objects.requireNonNull(scrapeCoordinator, "scrapeCoordinator is required");
        Objects.requireNonNull(generationChain, "generationChain is required");
        Objects.requireNonNull(generationExecutor, "generationExecutor is required");
        Objects.requireNonNull(queryProperties, "queryProperties is required");
        Objects.requireNonNull(publisher, "publisher is required");

        QueryMetricsPublisher effectiveMetrics = metricsPublisher != null ? metricsPublisher : QueryMetricsPublisher.NOOP;

        return new DefaultQueryOrchestrator(
                validator != null ? validator : new QueryValidator(queryProperties),
                new DatabaseCandidateSource(embeddingClient, vectorStore, queryProperties, keywordMatcher,
                        effectiveMetrics),
                scrapeCoordinator,
                dietaryFilter != null ? dietaryFilter : new DietaryFilter(),
                ranker != null ? ranker : new CandidateRanker(queryProperties.getResultCap()),
                new NarrativeGenerator(generationChain, generationExecutor, promptBuilder,
                        queryProperties.getMaxFacts()),
                cache != null ? cache : ResponseCache.disabled(),
                queryProperties,
                publisher,
                effectiveMetrics
        );
    }
}
