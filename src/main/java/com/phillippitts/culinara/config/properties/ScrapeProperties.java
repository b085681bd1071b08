package com.phillippitts.culinara.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the web scrape stage.
 */
@Validated
@ConfigurationProperties(prefix = "culinara.scrape")
public class ScrapeProperties {

    /** Maximum number of fetches in flight per stage. */
    @Min(1)
    private final int concurrency;

    @Min(1)
    private final long perTaskTimeoutMs;

    /** Wall-clock budget for a whole scrape stage. */
    @Min(1)
    private final long stageBudgetMs;

    /** Number of URLs requested from web search. */
    @Min(1)
    private final int seedLimit;

    /** Links followed from a single collection page. */
    @Min(0)
    private final int maxExpansionLinks;

    @ConstructorBinding
    public ScrapeProperties(Integer concurrency,
                            Long perTaskTimeoutMs,
                            Long stageBudgetMs,
                            Integer seedLimit,
                            Integer maxExpansionLinks) {
        this.concurrency = concurrency == null ? 5 : concurrency;
        this.perTaskTimeoutMs = perTaskTimeoutMs == null ? 15_000L : perTaskTimeoutMs;
        this.stageBudgetMs = stageBudgetMs == null ? 22_000L : stageBudgetMs;
        this.seedLimit = seedLimit == null ? 5 : seedLimit;
        this.maxExpansionLinks = maxExpansionLinks == null ? 5 : maxExpansionLinks;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public long getPerTaskTimeoutMs() {
        return perTaskTimeoutMs;
    }

    public long getStageBudgetMs() {
        return stageBudgetMs;
    }

    public int getSeedLimit() {
        return seedLimit;
    }

    public int getMaxExpansionLinks() {
        return maxExpansionLinks;
    }
}
