package com.phillippitts.culinara.config;

import com.phillippitts.culinara.exception.EmbeddingUnavailableException;
import com.phillippitts.culinara.exception.FetchException;
import com.phillippitts.culinara.exception.ProviderException;
import com.phillippitts.culinara.exception.SearchUnavailableException;
import com.phillippitts.culinara.exception.StoreUnavailableException;
import com.phillippitts.culinara.service.generation.TextGenerator;
import com.phillippitts.culinara.service.source.EmbeddingClient;
import com.phillippitts.culinara.service.source.PageFetcher;
import com.phillippitts.culinara.service.source.VectorStore;
import com.phillippitts.culinara.service.source.WebSearchClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.CompletableFuture;

/**
 * Placeholder collaborators used when no real adapter is registered.
 *
 * <p>Each placeholder reports its source as unavailable, so the application boots and answers
 * queries exactly as it would during an outage of that provider: no store results, no web
 * results, no narrative. Registering a real bean of the same type replaces the placeholder.
 */
@Configuration
public class SourceFallbackConfig {

    private static final Logger LOG = LogManager.getLogger(SourceFallbackConfig.class);

    static final String UNAVAILABLE_GENERATOR_ID = "unavailable";

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingClient embeddingClient() {
        LOG.warn("No EmbeddingClient registered; the recipe store will be reported unavailable");
        return text -> {
            throw new EmbeddingUnavailableException("No embedding client configured");
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public VectorStore vectorStore() {
        LOG.warn("No VectorStore registered; the recipe store will be reported unavailable");
        return (vector, topK, threshold) -> {
            throw new StoreUnavailableException("No vector store configured");
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public WebSearchClient webSearchClient() {
        LOG.warn("No WebSearchClient registered; the web fallback will be reported unavailable");
        return (text, limit) -> {
            throw new SearchUnavailableException("No web search client configured");
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public PageFetcher pageFetcher() {
        LOG.warn("No PageFetcher registered; every page fetch will fail");
        return url -> CompletableFuture.failedFuture(new FetchException("No page fetcher configured", url));
    }

    @Bean
    @ConditionalOnMissingBean
    public TextGenerator unavailableTextGenerator() {
        LOG.warn("No TextGenerator registered; responses will have no narrative");
        return new TextGenerator() {
            @Override
            public String id() {
                return UNAVAILABLE_GENERATOR_ID;
            }

            @Override
            public CompletableFuture<String> generate(String prompt) {
                return CompletableFuture.failedFuture(
                        new ProviderException("No text generator configured", UNAVAILABLE_GENERATOR_ID));
            }
        };
    }
}
