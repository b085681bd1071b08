package com.phillippitts.culinara.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes thread pool gauges via Micrometer for the scrape and generation executors:
 * {@code <pool>.pool.size}, {@code .active}, {@code .queued}, {@code .completed},
 * {@code .core.size} and {@code .max.size}, where {@code <pool>} is {@code scrape} or
 * {@code generation}.
 *
 * <p>Available at {@code GET /actuator/metrics/scrape.pool.active} and, in Prometheus format,
 * as {@code scrape_pool_active}. A health summary is also logged every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> scrapeExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> generationExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("scrapeExecutor") ObjectProvider<ThreadPoolTaskExecutor> scrapeExecutorProvider,
            @Qualifier("generationExecutor") ObjectProvider<ThreadPoolTaskExecutor> generationExecutorProvider) {
        this.scrapeExecutorProvider = scrapeExecutorProvider;
        this.generationExecutorProvider = generationExecutorProvider;
    }

    @Bean
    public MeterBinder executorPoolMetrics() {
        return registry -> {
            bind(registry, "scrape", scrapeExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "generation", generationExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: scrape.pool.* and generation.pool.* available via /actuator/metrics");
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder(pool + ".pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the " + pool + " pool")
                .register(registry);

        Gauge.builder(pool + ".pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing " + pool + " tasks")
                .register(registry);

        Gauge.builder(pool + ".pool.queued", executor, e -> e.getQueue().size())
                .description("Number of " + pool + " tasks waiting in the queue")
                .register(registry);

        Gauge.builder(pool + ".pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed " + pool + " tasks")
                .register(registry);

        Gauge.builder(pool + ".pool.core.size", executor, ThreadPoolExecutor::getCorePoolSize)
                .description("Configured core pool size for the " + pool + " executor")
                .register(registry);

        Gauge.builder(pool + ".pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .description("Configured maximum pool size for the " + pool + " executor")
                .register(registry);
    }

    /**
     * Logs thread pool health summary every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor scrape = scrapeExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor generation = generationExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Thread pool health: scrape size={}/{} active={} queued={}; generation size={}/{} active={} queued={}",
                scrape.getPoolSize(), scrape.getMaximumPoolSize(), scrape.getActiveCount(), scrape.getQueue().size(),
                generation.getPoolSize(), generation.getMaximumPoolSize(), generation.getActiveCount(),
                generation.getQueue().size());
    }
}
