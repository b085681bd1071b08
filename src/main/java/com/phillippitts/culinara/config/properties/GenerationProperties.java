package com.phillippitts.culinara.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the text generation fallback chain.
 */
@Validated
@ConfigurationProperties(prefix = "culinara.generation")
public class GenerationProperties {

    /**
     * Provider ids in the order they are tried. Empty means every registered provider, in bean
     * order.
     */
    private final List<String> providers;

    @Min(1)
    private final long attemptTimeoutMs;

    @ConstructorBinding
    public GenerationProperties(List<String> providers, Long attemptTimeoutMs) {
        this.providers = providers == null ? List.of() : List.copyOf(providers);
        this.attemptTimeoutMs = attemptTimeoutMs == null ? 5_000L : attemptTimeoutMs;
    }

    public List<String> getProviders() {
        return providers;
    }

    public long getAttemptTimeoutMs() {
        return attemptTimeoutMs;
    }
}
