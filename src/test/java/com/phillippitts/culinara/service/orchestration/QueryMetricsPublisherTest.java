package com.phillippitts.culinara.service.orchestration;

import com.phillippitts.culinara.service.metrics.QueryMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class QueryMetricsPublisherTest {

    @Test
    void noopPublisherIgnoresEverything() {
        QueryMetricsPublisher noop = QueryMetricsPublisher.NOOP;

        assertThat(noop.isEnabled()).isFalse();
        assertThatCode(() -> {
            noop.recordQuery("answered", 1_000_000L);
            noop.recordSourceUsed("database");
            noop.recordSourceUnavailable("vector-store");
            noop.recordScrapeFailure("timeout");
            noop.recordScrapeBudgetExhausted();
            noop.recordGenerationFallback("primary", "error");
            noop.recordSlowQuery();
        }).doesNotThrowAnyException();
    }

    @Test
    void delegatesToMetricsWhenPresent() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        QueryMetricsPublisher publisher = new QueryMetricsPublisher(new QueryMetrics(registry));

        publisher.recordSourceUsed("database");
        publisher.recordSlowQuery();

        assertThat(publisher.isEnabled()).isTrue();
        assertThat(registry.find("culinara.query.source.used").tag("source", "database").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("culinara.query.slow").counter().count()).isEqualTo(1.0);
    }
}
