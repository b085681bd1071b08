package com.phillippitts.culinara.config;

import com.phillippitts.culinara.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by the query pipeline.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 *
 * <p>Both pools share the same policies:
 * <ul>
 *   <li>Bounded queue, so bursts cannot grow memory without limit</li>
 *   <li>{@link ThreadPoolExecutor.CallerRunsPolicy} on saturation, which gives backpressure
 *       instead of failing the request</li>
 *   <li>Log4j2 ThreadContext (MDC) copied from the submitting thread, so async log lines keep
 *       the request id</li>
 * </ul>
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for scrape worker loops ({@code threadpool.scrape.*}). Each scrape stage occupies
     * {@code culinara.scrape.concurrency} threads while it runs.
     *
     * @return configured executor for scrape workers
     */
    @Bean(name = "scrapeExecutor")
    public ThreadPoolTaskExecutor scrapeExecutor() {
        return newExecutor(threadPoolProperties.getScrape());
    }

    /**
     * Executor for the summary and facts generation chains ({@code threadpool.generation.*}).
     *
     * @return configured executor for generation
     */
    @Bean(name = "generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor() {
        return newExecutor(threadPoolProperties.getGeneration());
    }

    public static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext into the worker and restores the worker's own
     * context afterwards.
     */
    static TaskDecorator threadContextPropagation() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
