package com.phillippitts.culinara.config;

import com.phillippitts.culinara.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateScrapeExecutorWithDefaults() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        executor = config.scrapeExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(10);
        assertThat(executor.getMaxPoolSize()).isEqualTo(20);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("scrape-pool-");
    }

    @Test
    void shouldCreateGenerationExecutorWithDefaults() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        executor = config.generationExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(4);
        assertThat(executor.getMaxPoolSize()).isEqualTo(8);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("generation-pool-");
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).scrapeExecutor();

        int taskCount = 30;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completed = new AtomicInteger();
        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(5);
                    completed.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completed.get()).isEqualTo(taskCount);
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).generationExecutor();
        ThreadContext.put("requestId", "req-42");

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            latch.countDown();
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-42");
    }

    @Test
    void shouldRestoreWorkerContextAfterTask() {
        ThreadContext.put("requestId", "submitter");
        Runnable decorated = ThreadPoolConfig.threadContextPropagation().decorate(() ->
                assertThat(ThreadContext.get("requestId")).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("requestId", "worker");
        decorated.run();

        assertThat(ThreadContext.get("requestId")).isEqualTo("worker");
    }
}
