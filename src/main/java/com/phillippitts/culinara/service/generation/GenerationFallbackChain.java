package com.phillippitts.culinara.service.generation;

import com.phillippitts.culinara.config.properties.GenerationProperties;
import com.phillippitts.culinara.domain.GenerationResult;
import com.phillippitts.culinara.exception.ProviderTimeoutException;
import com.phillippitts.culinara.service.generation.event.AllProvidersFailedEvent;
import com.phillippitts.culinara.service.generation.event.GenerationFallbackEvent;
import com.phillippitts.culinara.service.orchestration.QueryMetricsPublisher;
import com.phillippitts.culinara.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tries text generation providers in order until one returns non-blank text.
 *
 * <p>Order comes from {@code culinara.generation.providers}; ids with no registered provider are
 * skipped with a warning, and an empty list means every provider in bean order. Each attempt is
 * bounded by {@code attempt-timeout-ms} and a timed-out attempt is cancelled, so a call returns
 * within (number of providers) x (attempt timeout).
 *
 * <p>A timeout, an exception or blank text publishes a {@link GenerationFallbackEvent} and moves
 * on. When every provider fails an {@link AllProvidersFailedEvent} is published and
 * {@link GenerationResult#failure()} is returned; this method never throws for provider failures.
 */
@Service
public class GenerationFallbackChain {
    private static final Logger LOG = LogManager.getLogger(GenerationFallbackChain.class);

    private final List<TextGenerator> chain;
    private final long attemptTimeoutMs;
    private final ApplicationEventPublisher publisher;
    private final QueryMetricsPublisher metrics;

    public GenerationFallbackChain(List<TextGenerator> generators,
                                   GenerationProperties props,
                                   ApplicationEventPublisher publisher,
                                   QueryMetricsPublisher metrics) {
        Objects.requireNonNull(generators);
        Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = metrics == null ? QueryMetricsPublisher.NOOP : metrics;
        this.attemptTimeoutMs = props.getAttemptTimeoutMs();
        this.chain = order(generators, props.getProviders());
        LOG.info("Generation chain: {}", chain.stream().map(TextGenerator::id).toList());
    }

    private static List<TextGenerator> order(List<TextGenerator> generators, List<String> configured) {
        if (configured.isEmpty()) {
            return List.copyOf(generators);
        }
        Map<String, TextGenerator> byId = new LinkedHashMap<>();
        for (TextGenerator g : generators) {
            byId.putIfAbsent(g.id().toLowerCase(Locale.ROOT), g);
        }
        List<TextGenerator> ordered = new ArrayList<>();
        for (String id : configured) {
            TextGenerator g = byId.get(id.trim().toLowerCase(Locale.ROOT));
            if (g == null) {
                LOG.warn("Skipping unknown generation provider '{}'", id);
            } else if (!ordered.contains(g)) {
                ordered.add(g);
            }
        }
        return List.copyOf(ordered);
    }

    /**
     * Runs the prompt through the chain.
     *
     * @param prompt prompt text
     * @return the first successful result, or {@link GenerationResult#failure()}
     */
    public GenerationResult generate(String prompt) {
        for (TextGenerator g : chain) {
            long t0 = System.nanoTime();
            String reason;
            CompletableFuture<String> future = null;
            try {
                future = g.generate(prompt);
                String text = future.get(attemptTimeoutMs, TimeUnit.MILLISECONDS);
                if (text != null && !text.isBlank()) {
                    LOG.debug("Generated via {} in {} ms (chars={})", g.id(), TimeUtils.elapsedMillis(t0),
                            text.length());
                    return GenerationResult.success(text.strip(), g.id());
                }
                reason = "blank";
            } catch (TimeoutException e) {
                future.cancel(true);
                reason = "timeout";
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                reason = cause instanceof ProviderTimeoutException ? "timeout" : "error";
                LOG.warn("Provider {} failed: {}", g.id(), cause.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel(future);
                LOG.warn("Generation interrupted while waiting for {}", g.id());
                break;
            } catch (RuntimeException e) {
                reason = "error";
                LOG.warn("Provider {} failed: {}", g.id(), e.toString());
            }
            metrics.recordGenerationFallback(g.id(), reason);
            publisher.publishEvent(new GenerationFallbackEvent(g.id(), reason, Instant.now()));
        }
        publisher.publishEvent(new AllProvidersFailedEvent(chain.size(), Instant.now()));
        return GenerationResult.failure();
    }

    private static void cancel(CompletableFuture<String> future) {
        if (future != null) {
            future.cancel(true);
        }
    }

    /** Provider ids in the order they are tried. */
    public List<String> providerIds() {
        return chain.stream().map(TextGenerator::id).toList();
    }
}
