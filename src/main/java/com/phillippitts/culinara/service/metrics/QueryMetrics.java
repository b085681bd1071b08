package com.phillippitts.culinara.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for recipe queries.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Query latency by outcome (answered, empty, error)</li>
 *   <li>Which sources each query consulted</li>
 *   <li>Scrape failures by reason and stage budget exhaustion</li>
 *   <li>Generation fallbacks per provider</li>
 *   <li>Queries that overran their soft deadline</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class QueryMetrics {

    private static final String METRIC_PREFIX = "culinara.query";

    private final MeterRegistry registry;

    public QueryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records end-to-end query latency.
     *
     * @param outcome query outcome (answered, empty, error)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to answer a recipe query")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the usage counter for a candidate source.
     *
     * @param source source name (database, web)
     */
    public void incrementSourceUsage(String source) {
        Counter.builder(METRIC_PREFIX + ".source.used")
                .description("Number of queries that consulted a candidate source")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * Increments the unavailable counter for a candidate source.
     *
     * @param source source name (embedding, vector-store, web-search)
     */
    public void incrementSourceUnavailable(String source) {
        Counter.builder(METRIC_PREFIX + ".source.unavailable")
                .description("Number of times a candidate source could not be reached")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * Increments the scrape failure counter.
     *
     * @param reason failure reason (timeout, error, empty, depth-cap)
     */
    public void incrementScrapeFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".scrape.failure")
                .description("Number of scrape tasks that produced no candidate")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementScrapeBudgetExhausted() {
        Counter.builder(METRIC_PREFIX + ".scrape.budget.exhausted")
                .description("Number of scrape stages cut short by the stage budget")
                .register(registry)
                .increment();
    }

    /**
     * Increments the fallback counter for a generation provider.
     *
     * @param provider provider that failed
     * @param reason failure reason (timeout, error, blank)
     */
    public void incrementGenerationFallback(String provider, String reason) {
        Counter.builder(METRIC_PREFIX + ".generation.fallback")
                .description("Number of generation attempts that fell through to the next provider")
                .tag("provider", provider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementSlowQuery() {
        Counter.builder(METRIC_PREFIX + ".slow")
                .description("Number of queries that overran the soft deadline")
                .register(registry)
                .increment();
    }
}
