package com.phillippitts.culinara.service.orchestration;

import com.phillippitts.culinara.service.metrics.QueryMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Centralizes query metrics recording for the orchestrator, scrape stage and generation chain.
 *
 * <p><b>Null Safety:</b> All methods handle a null {@link QueryMetrics} gracefully, so services
 * can run without a meter registry in unit tests.
 *
 * @see QueryMetrics
 */
@Component
public final class QueryMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(QueryMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and builder defaults.
     */
    public static final QueryMetricsPublisher NOOP = new QueryMetricsPublisher(null);

    private final QueryMetrics metrics;

    /**
     * Constructs a metrics publisher with optional metrics support.
     *
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public QueryMetricsPublisher(QueryMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("QueryMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records a finished query.
     *
     * @param outcome query outcome (answered, empty, error)
     * @param durationNanos query duration in nanoseconds
     */
    public void recordQuery(String outcome, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(outcome, durationNanos);
    }

    public void recordSourceUsed(String source) {
        if (metrics == null) {
            return;
        }
        metrics.incrementSourceUsage(source);
    }

    public void recordSourceUnavailable(String source) {
        if (metrics == null) {
            return;
        }
        metrics.incrementSourceUnavailable(source);
    }

    public void recordScrapeFailure(String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementScrapeFailure(reason);
    }

    public void recordScrapeBudgetExhausted() {
        if (metrics == null) {
            return;
        }
        metrics.incrementScrapeBudgetExhausted();
    }

    public void recordGenerationFallback(String provider, String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementGenerationFallback(provider, reason);
    }

    public void recordSlowQuery() {
        if (metrics == null) {
            return;
        }
        metrics.incrementSlowQuery();
    }

    /**
     * Checks if metrics tracking is enabled.
     *
     * @return true if metrics are available, false if running in test mode
     */
    public boolean isEnabled() {
        return metrics != null;
    }
}
