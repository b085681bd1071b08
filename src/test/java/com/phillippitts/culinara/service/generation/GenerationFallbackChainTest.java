package com.phillippitts.culinara.service.generation;

import com.phillippitts.culinara.config.properties.GenerationProperties;
import com.phillippitts.culinara.domain.GenerationResult;
import com.phillippitts.culinara.exception.ProviderTimeoutException;
import com.phillippitts.culinara.service.generation.event.AllProvidersFailedEvent;
import com.phillippitts.culinara.service.generation.event.GenerationFallbackEvent;
import com.phillippitts.culinara.service.metrics.QueryMetrics;
import com.phillippitts.culinara.service.orchestration.QueryMetricsPublisher;
import com.phillippitts.culinara.testutil.EventCapturingPublisher;
import com.phillippitts.culinara.testutil.FakeTextGenerator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationFallbackChainTest {

    private EventCapturingPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new EventCapturingPublisher();
    }

    private GenerationFallbackChain chain(List<String> order, long timeoutMs, TextGenerator... generators) {
        return new GenerationFallbackChain(List.of(generators), new GenerationProperties(order, timeoutMs),
                publisher, QueryMetricsPublisher.NOOP);
    }

    @Test
    void firstSuccessfulProviderWins() {
        FakeTextGenerator primary = FakeTextGenerator.replying("primary", "  Here you go.  ");
        FakeTextGenerator secondary = FakeTextGenerator.replying("secondary", "unused");

        GenerationResult result = chain(List.of(), 1000, primary, secondary).generate("prompt");

        assertThat(result.ok()).isTrue();
        assertThat(result.text()).isEqualTo("Here you go.");
        assertThat(result.provider()).isEqualTo("primary");
        assertThat(secondary.calls()).isZero();
        assertThat(publisher.all()).isEmpty();
    }

    @Test
    void configuredOrderIsFollowedIgnoringCase() {
        FakeTextGenerator a = FakeTextGenerator.replying("alpha", "from alpha");
        FakeTextGenerator b = FakeTextGenerator.replying("beta", "from beta");

        GenerationFallbackChain chain = chain(List.of("BETA", "alpha"), 1000, a, b);

        assertThat(chain.providerIds()).containsExactly("beta", "alpha");
        assertThat(chain.generate("prompt").provider()).isEqualTo("beta");
        assertThat(a.calls()).isZero();
    }

    @Test
    void unknownAndDuplicateIdsAreSkipped() {
        FakeTextGenerator a = FakeTextGenerator.replying("alpha", "text");

        GenerationFallbackChain chain = chain(List.of("missing", "alpha", "Alpha"), 1000, a);

        assertThat(chain.providerIds()).containsExactly("alpha");
    }

    @Test
    void failureMovesToNextProviderAndPublishesEvent() {
        FakeTextGenerator broken = FakeTextGenerator.failing("broken");
        FakeTextGenerator working = FakeTextGenerator.replying("working", "summary");

        GenerationResult result = chain(List.of(), 1000, broken, working).generate("prompt");

        assertThat(result.provider()).isEqualTo("working");
        List<GenerationFallbackEvent> events = publisher.eventsOf(GenerationFallbackEvent.class);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).provider()).isEqualTo("broken");
        assertThat(events.get(0).reason()).isEqualTo("error");
    }

    @Test
    void blankTextCountsAsFailure() {
        FakeTextGenerator blank = FakeTextGenerator.replying("blank", "   ");
        FakeTextGenerator working = FakeTextGenerator.replying("working", "summary");

        GenerationResult result = chain(List.of(), 1000, blank, working).generate("prompt");

        assertThat(result.provider()).isEqualTo("working");
        assertThat(publisher.eventsOf(GenerationFallbackEvent.class))
                .extracting(GenerationFallbackEvent::reason).containsExactly("blank");
    }

    @Test
    void slowProviderIsAbandonedAfterAttemptTimeout() {
        FakeTextGenerator slow = FakeTextGenerator.slow("slow", 3000, "late");
        FakeTextGenerator fast = FakeTextGenerator.replying("fast", "on time");

        long start = System.currentTimeMillis();
        GenerationResult result = chain(List.of(), 100, slow, fast).generate("prompt");
        long elapsed = System.currentTimeMillis() - start;

        assertThat(result.provider()).isEqualTo("fast");
        assertThat(elapsed).isLessThan(2000);
        assertThat(publisher.eventsOf(GenerationFallbackEvent.class))
                .extracting(GenerationFallbackEvent::reason).containsExactly("timeout");
    }

    @Test
    void providerReportedTimeoutIsClassifiedAsTimeout() {
        FakeTextGenerator timedOut = FakeTextGenerator.failingWith("remote",
                new ProviderTimeoutException("remote", 30_000));

        chain(List.of(), 1000, timedOut).generate("prompt");

        assertThat(publisher.eventsOf(GenerationFallbackEvent.class))
                .extracting(GenerationFallbackEvent::reason).containsExactly("timeout");
    }

    @Test
    void totalTimeIsBoundedByProvidersTimesAttemptTimeout() {
        long start = System.currentTimeMillis();
        GenerationResult result = chain(List.of(), 100,
                FakeTextGenerator.slow("one", 3000, "x"),
                FakeTextGenerator.slow("two", 3000, "x"),
                FakeTextGenerator.slow("three", 3000, "x")).generate("prompt");
        long elapsed = System.currentTimeMillis() - start;

        assertThat(result.ok()).isFalse();
        assertThat(elapsed).isLessThan(1500);
    }

    @Test
    void allProvidersFailingYieldsFailureAndEvent() {
        GenerationResult result = chain(List.of(), 1000,
                FakeTextGenerator.failing("one"), FakeTextGenerator.replying("two", "")).generate("prompt");

        assertThat(result).isEqualTo(GenerationResult.failure());
        assertThat(result.text()).isEmpty();
        assertThat(publisher.eventsOf(GenerationFallbackEvent.class)).hasSize(2);
        assertThat(publisher.eventsOf(AllProvidersFailedEvent.class))
                .singleElement()
                .extracting(AllProvidersFailedEvent::attempted)
                .isEqualTo(2);
    }

    @Test
    void generatorThrowingSynchronouslyIsTreatedAsError() {
        TextGenerator throwing = new TextGenerator() {
            @Override
            public String id() {
                return "throwing";
            }

            @Override
            public java.util.concurrent.CompletableFuture<String> generate(String prompt) {
                throw new IllegalStateException("client not initialised");
            }
        };

        GenerationResult result = chain(List.of(), 1000, throwing, FakeTextGenerator.replying("ok", "fine"))
                .generate("prompt");

        assertThat(result.provider()).isEqualTo("ok");
    }

    @Test
    void fallbacksAreCounted() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        GenerationFallbackChain chain = new GenerationFallbackChain(
                List.of(FakeTextGenerator.failing("broken"), FakeTextGenerator.replying("ok", "fine")),
                new GenerationProperties(null, 1000L), publisher,
                new QueryMetricsPublisher(new QueryMetrics(registry)));

        chain.generate("prompt");

        assertThat(registry.find("culinara.query.generation.fallback")
                .tag("provider", "broken").tag("reason", "error").counter().count()).isEqualTo(1.0);
    }
}
