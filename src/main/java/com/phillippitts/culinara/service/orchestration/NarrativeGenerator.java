package com.phillippitts.culinara.service.orchestration;

import com.phillippitts.culinara.domain.Candidate;
import com.phillippitts.culinara.domain.GenerationResult;
import com.phillippitts.culinara.domain.Query;
import com.phillippitts.culinara.service.generation.FactsParser;
import com.phillippitts.culinara.service.generation.GenerationFallbackChain;
import com.phillippitts.culinara.service.generation.PromptBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the summary and facts prompts through the generation chain concurrently.
 *
 * <p>A failed summary becomes an empty narrative and failed facts an empty list; this class never
 * throws for generation failures.
 */
public class NarrativeGenerator {
    private static final Logger LOG = LogManager.getLogger(NarrativeGenerator.class);

    private final GenerationFallbackChain chain;
    private final Executor executor;
    private final PromptBuilder prompts;
    private final int maxFacts;

    /**
     * Generated text for a response.
     *
     * @param summary narrative, empty when generation failed
     * @param facts   trivia facts, possibly empty
     */
    public record Narrative(String summary, List<String> facts) {
        public static final Narrative EMPTY = new Narrative("", List.of());
    }

    public NarrativeGenerator(GenerationFallbackChain chain, Executor executor, PromptBuilder prompts, int maxFacts) {
        this.chain = Objects.requireNonNull(chain);
        this.executor = Objects.requireNonNull(executor);
        this.prompts = prompts == null ? new PromptBuilder() : prompts;
        this.maxFacts = maxFacts;
    }

    public Narrative narrate(Query query, List<Candidate> ranked) {
        if (ranked.isEmpty()) {
            return Narrative.EMPTY;
        }
        String summaryPrompt = prompts.summaryPrompt(query, ranked);
        CompletableFuture<GenerationResult> summary = submit("summary", summaryPrompt);
        CompletableFuture<GenerationResult> facts = maxFacts > 0
                ? submit("facts", prompts.factsPrompt(query, ranked, maxFacts))
                : CompletableFuture.completedFuture(GenerationResult.failure());

        GenerationResult s = summary.join();
        GenerationResult f = facts.join();
        LOG.debug("Narrative: summary via {}, facts via {}", s.provider(), f.provider());
        return new Narrative(s.ok() ? s.text() : "", f.ok() ? FactsParser.parse(f.text(), maxFacts) : List.of());
    }

    private CompletableFuture<GenerationResult> submit(String kind, String prompt) {
        try {
            return CompletableFuture.supplyAsync(() -> chain.generate(prompt), executor)
                    .exceptionally(e -> {
                        LOG.warn("{} generation failed unexpectedly: {}", kind, e.toString());
                        return GenerationResult.failure();
                    });
        } catch (RejectedExecutionException e) {
            LOG.warn("{} generation rejected by executor: {}", kind, e.getMessage());
            return CompletableFuture.completedFuture(GenerationResult.failure());
        }
    }
}
