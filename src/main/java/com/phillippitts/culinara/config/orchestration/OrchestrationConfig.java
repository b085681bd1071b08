package com.phillippitts.culinara.config.orchestration;

import com.phillippitts.culinara.config.properties.QueryProperties;
import com.phillippitts.culinara.service.cache.ResponseCache;
import com.phillippitts.culinara.service.diet.DietaryFilter;
import com.phillippitts.culinara.service.generation.GenerationFallbackChain;
import com.phillippitts.culinara.service.generation.PromptBuilder;
import com.phillippitts.culinara.service.orchestration.QueryMetricsPublisher;
import com.phillippitts.culinara.service.orchestration.QueryOrchestrator;
import com.phillippitts.culinara.service.orchestration.QueryOrchestratorBuilder;
import com.phillippitts.culinara.service.rank.CandidateRanker;
import com.phillippitts.culinara.service.rank.KeywordMatcher;
import com.phillippitts.culinara.service.scrape.ScrapeCoordinator;
import com.phillippitts.culinara.service.source.EmbeddingClient;
import com.phillippitts.culinara.service.source.VectorStore;
import com.phillippitts.culinara.service.validation.QueryValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the {@link QueryOrchestrator} explicitly through {@link QueryOrchestratorBuilder}.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public CandidateRanker candidateRanker(QueryProperties queryProperties) {
        return new CandidateRanker(queryProperties.getResultCap());
    }

    @Bean
    public QueryOrchestrator queryOrchestrator(EmbeddingClient embeddingClient,
                                               VectorStore vectorStore,
                                               ScrapeCoordinator scrapeCoordinator,
                                               GenerationFallbackChain generationChain,
                                               @Qualifier("generationExecutor") Executor generationExecutor,
                                               QueryProperties queryProperties,
                                               QueryValidator validator,
                                               DietaryFilter dietaryFilter,
                                               CandidateRanker candidateRanker,
                                               ResponseCache responseCache,
                                               ApplicationEventPublisher publisher,
                                               QueryMetricsPublisher metricsPublisher) {
        return QueryOrchestratorBuilder.builder()
                .embeddingClient(embeddingClient)
                .vectorStore(vectorStore)
                .scrapeCoordinator(scrapeCoordinator)
                .generationChain(generationChain)
                .generationExecutor(generationExecutor)
                .queryProperties(queryProperties)
                .validator(validator)
                .dietaryFilter(dietaryFilter)
                .ranker(candidateRanker)
                .keywordMatcher(new KeywordMatcher())
                .promptBuilder(new PromptBuilder())
                .cache(responseCache)
                .publisher(publisher)
                .metricsPublisher(metricsPublisher)
                .build();
    }
}
