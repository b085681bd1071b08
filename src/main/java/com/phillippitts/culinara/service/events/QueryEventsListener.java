package com.phillippitts.culinara.service.events;

import com.phillippitts.culinara.service.generation.event.AllProvidersFailedEvent;
import com.phillippitts.culinara.service.orchestration.event.SlowQueryEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing warnings for degraded queries. Throttled to avoid log spam when a provider
 * outage slows every request.
 */
@Component
class QueryEventsListener {
    private static final Logger LOG = LogManager.getLogger(QueryEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSlowQuery(SlowQueryEvent e) {
        if (shouldLog("slow-query")) {
            LOG.warn("Queries are exceeding the {} ms soft deadline (latest: {} ms). "
                    + "Check upstream provider latency and culinara.scrape.* budgets.", e.deadlineMs(), e.elapsedMs());
        }
    }

    @EventListener
    void onAllProvidersFailed(AllProvidersFailedEvent e) {
        if (shouldLog("generation-down")) {
            LOG.warn("No generation provider is answering ({} tried); responses are returned without a narrative. "
                    + "Check culinara.generation.providers.", e.attempted());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
