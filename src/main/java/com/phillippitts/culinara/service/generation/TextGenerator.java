package com.phillippitts.culinara.service.generation;

import com.phillippitts.culinara.exception.ProviderException;
import com.phillippitts.culinara.exception.ProviderTimeoutException;

import java.util.concurrent.CompletableFuture;

/**
 * A text generation (LLM) provider. Several can be registered; {@link GenerationFallbackChain}
 * tries them in the configured order.
 */
public interface TextGenerator {

    /**
     * Stable provider id used in {@code culinara.generation.providers}, logs and metrics.
     */
    String id();

    /**
     * Generates text for a prompt.
     *
     * @param prompt prompt text
     * @return future completed with the generated text, or exceptionally with
     *         {@link ProviderTimeoutException} or {@link ProviderException}
     */
    CompletableFuture<String> generate(String prompt);
}
