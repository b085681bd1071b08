package com.phillippitts.culinara.service.generation;

import com.phillippitts.culinara.service.generation.event.GenerationFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs generation fallback events succinctly (no prompt text). Total outages are reported once per
 * throttle window by {@code QueryEventsListener}.
 */
@Component
class GenerationEventsListener {
    private static final Logger LOG = LogManager.getLogger(GenerationEventsListener.class);

    @EventListener
    void onFallback(GenerationFallbackEvent e) {
        LOG.info("Generation fallback: provider={}, reason={}", e.provider(), e.reason());
    }
}
