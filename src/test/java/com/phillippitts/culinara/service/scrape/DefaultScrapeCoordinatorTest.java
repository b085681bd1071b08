package com.phillippitts.culinara.service.scrape;

import com.phillippitts.culinara.config.ThreadPoolConfig;
import com.phillippitts.culinara.config.properties.ScrapeProperties;
import com.phillippitts.culinara.config.properties.ThreadPoolProperties;
import com.phillippitts.culinara.domain.Candidate;
import com.phillippitts.culinara.domain.Provenance;
import com.phillippitts.culinara.exception.SearchUnavailableException;
import com.phillippitts.culinara.service.metrics.QueryMetrics;
import com.phillippitts.culinara.service.orchestration.QueryMetricsPublisher;
import com.phillippitts.culinara.service.source.FetchedPage;
import com.phillippitts.culinara.service.source.WebSearchClient;
import com.phillippitts.culinara.testutil.FakePageFetcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultScrapeCoordinatorTest {

    private static final String A = "https://site.test/a";
    private static final String B = "https://site.test/b";
    private static final String C = "https://site.test/c";
    private static final String D = "https://site.test/d";

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private QueryMetricsPublisher metrics;
    private FakePageFetcher fetcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        registry = new SimpleMeterRegistry();
        metrics = new QueryMetricsPublisher(new QueryMetrics(registry));
        fetcher = new FakePageFetcher();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private DefaultScrapeCoordinator coordinator(ScrapeProperties props) {
        return coordinator(props, (text, limit) -> List.of());
    }

    private DefaultScrapeCoordinator coordinator(ScrapeProperties props, WebSearchClient search) {
        return new DefaultScrapeCoordinator(search, fetcher, executor, props, metrics);
    }

    private static ScrapeProperties props(int concurrency, long perTaskMs, long budgetMs, int maxLinks) {
        return new ScrapeProperties(concurrency, perTaskMs, budgetMs, 5, maxLinks);
    }

    private double failures(String reason) {
        Counter counter = registry.find("culinara.query.scrape.failure").tag("reason", reason).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Test
    void failedPagesAreDroppedAndTheRestSurvive() {
        fetcher.recipe(A, "Chicken Curry", "chicken", "curry powder")
                .failing(B)
                .recipe(C, "Butter Chicken", "chicken", "butter")
                .failing(D);

        List<Candidate> results = coordinator(props(3, 1000, 5000, 5))
                .scrape("chicken curry", List.of(A, B, C, D));

        assertThat(results).extracting(Candidate::title).containsExactly("Chicken Curry", "Butter Chicken");
        assertThat(results).allSatisfy(c -> {
            assertThat(c.provenance()).isEqualTo(Provenance.FROM_WEB);
            assertThat(c.score()).isBetween(0.0, 1.0);
        });
        assertThat(failures("error")).isEqualTo(2.0);
    }

    @Test
    void slowFetchIsAbandonedAfterPerTaskTimeout() {
        fetcher.recipe(A, "Slow Soup", "water").delay(A, 3000)
                .recipe(B, "Fast Salad", "lettuce");

        long start = System.currentTimeMillis();
        List<Candidate> results = coordinator(props(2, 150, 10_000, 5)).scrape("soup", List.of(A, B));
        long elapsed = System.currentTimeMillis() - start;

        assertThat(results).extracting(Candidate::title).containsExactly("Fast Salad");
        assertThat(elapsed).isLessThan(2000);
        assertThat(failures("timeout")).isEqualTo(1.0);
    }

    @Test
    void neverRunsMoreFetchesThanConcurrency() {
        List<String> seeds = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            String url = "https://site.test/r" + i;
            fetcher.recipe(url, "Recipe " + i, "rice").delay(url, 80);
            seeds.add(url);
        }

        List<Candidate> results = coordinator(props(2, 2000, 10_000, 5)).scrape("rice", seeds);

        assertThat(results).hasSize(6);
        assertThat(fetcher.maxInFlight()).isLessThanOrEqualTo(2);
    }

    @Test
    void resultsFollowDiscoveryOrderNotCompletionOrder() {
        fetcher.recipe(A, "First", "x").delay(A, 250)
                .recipe(B, "Second", "x")
                .recipe(C, "Third", "x").delay(C, 60);

        List<Candidate> results = coordinator(props(3, 2000, 5000, 5)).scrape("x", List.of(A, B, C));

        assertThat(results).extracting(Candidate::title).containsExactly("First", "Second", "Third");
    }

    @Test
    void collectionPagesAreExpandedOneLevelUpToTheLinkCap() {
        String l1 = "https://site.test/l1";
        String l2 = "https://site.test/l2";
        String l3 = "https://site.test/l3";
        fetcher.collection(A, l1, l2, l3)
                .recipe(l1, "Linked One", "x")
                .recipe(l2, "Linked Two", "x")
                .recipe(l3, "Linked Three", "x")
                .recipe(B, "Seed Two", "x");

        List<Candidate> results = coordinator(props(2, 1000, 5000, 2)).scrape("x", List.of(A, B));

        assertThat(results).extracting(Candidate::title).containsExactly("Linked One", "Linked Two", "Seed Two");
        assertThat(fetcher.fetchCount(l3)).isZero();
        assertThat(results).noneMatch(c -> c.sourceId().equals(A));
    }

    @Test
    void recipePagesWithListingStyleTitlesAreKept() {
        fetcher.recipe(A, "Chana Masala | Vegan Recipes", "chickpeas", "tomato")
                .recipe(B, "Lentil Soup - Easy Recipes", "lentils", "carrot");

        List<Candidate> results = coordinator(props(2, 1000, 5000, 5)).scrape("chana masala", List.of(A, B));

        assertThat(results).extracting(Candidate::title)
                .containsExactly("Chana Masala | Vegan Recipes", "Lentil Soup - Easy Recipes");
    }

    @Test
    void concurrentStagesDoNotStarveEachOther() {
        ThreadPoolProperties.PoolProperties pool = new ThreadPoolProperties.PoolProperties();
        pool.setCorePoolSize(2);
        pool.setMaxPoolSize(2);
        pool.setQueueCapacity(100);
        pool.setThreadNamePrefix("scrape-test-");
        ThreadPoolTaskExecutor shared = ThreadPoolConfig.newExecutor(pool);
        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<List<String>> seedsPerStage = new ArrayList<>();
            for (int stage = 0; stage < 4; stage++) {
                List<String> seeds = new ArrayList<>();
                for (int i = 0; i < 5; i++) {
                    String url = "https://site.test/s" + stage + "/r" + i;
                    fetcher.recipe(url, "Recipe " + stage + "-" + i, "rice").delay(url, 500);
                    seeds.add(url);
                }
                seedsPerStage.add(seeds);
            }
            DefaultScrapeCoordinator coordinator =
                    new DefaultScrapeCoordinator((text, limit) -> List.of(), fetcher, shared,
                            props(5, 2000, 1500, 5), metrics);

            List<CompletableFuture<List<Candidate>>> stages = new ArrayList<>();
            for (List<String> seeds : seedsPerStage) {
                stages.add(CompletableFuture.supplyAsync(() -> coordinator.scrape("rice", seeds), callers));
            }

            for (CompletableFuture<List<Candidate>> stage : stages) {
                assertThat(stage.join()).hasSize(5);
            }
            assertThat(registry.find("culinara.query.scrape.budget.exhausted").counter()).isNull();
        } finally {
            callers.shutdownNow();
            shared.shutdown();
        }
    }

    @Test
    void collectionDetectedFromTitleIsExpandedToo() {
        String l1 = "https://site.test/l1";
        fetcher.page(A, new FetchedPage(A, "25 Easy Weeknight Dinners", List.of(), List.of(), null, false,
                        List.of(l1)))
                .recipe(l1, "Sheet Pan Chicken", "chicken");

        List<Candidate> results = coordinator(props(2, 1000, 5000, 5)).scrape("chicken dinner", List.of(A));

        assertThat(results).extracting(Candidate::title).containsExactly("Sheet Pan Chicken");
    }

    @Test
    void nestedCollectionPagesAreDropped() {
        String nested = "https://site.test/nested";
        String deep = "https://site.test/deep";
        fetcher.collection(A, nested)
                .collection(nested, deep)
                .recipe(deep, "Too Deep", "x");

        List<Candidate> results = coordinator(props(2, 1000, 5000, 5)).scrape("x", List.of(A));

        assertThat(results).isEmpty();
        assertThat(fetcher.fetchCount(deep)).isZero();
        assertThat(failures("depth-cap")).isEqualTo(1.0);
    }

    @Test
    void eachUrlIsFetchedAtMostOnce() {
        fetcher.collection(A, B, C)
                .recipe(B, "Shared", "x")
                .recipe(C, "Only Linked", "x");

        List<Candidate> results = coordinator(props(1, 1000, 5000, 5)).scrape("x", List.of(A, B));

        assertThat(fetcher.fetchCount(B)).isEqualTo(1);
        assertThat(results).extracting(Candidate::title).containsExactlyInAnyOrder("Shared", "Only Linked");
    }

    @Test
    void stageBudgetReturnsWhatCompleted() {
        fetcher.recipe(A, "Quick", "x")
                .recipe(B, "Glacial", "x").delay(B, 3000);

        long start = System.currentTimeMillis();
        List<Candidate> results = coordinator(props(2, 10_000, 300, 5)).scrape("x", List.of(A, B));
        long elapsed = System.currentTimeMillis() - start;

        assertThat(results).extracting(Candidate::title).containsExactly("Quick");
        assertThat(elapsed).isLessThan(2000);
        assertThat(registry.find("culinara.query.scrape.budget.exhausted").counter()).isNotNull();
        assertThat(registry.find("culinara.query.scrape.budget.exhausted").counter().count()).isEqualTo(1.0);
    }

    @Test
    void emptyPagesAreSkipped() {
        fetcher.page(A, FetchedPage.recipe(A, "", List.of(), List.of(), null))
                .recipe(B, "Real Recipe", "x");

        List<Candidate> results = coordinator(props(2, 1000, 5000, 5)).scrape("x", List.of(A, B));

        assertThat(results).extracting(Candidate::title).containsExactly("Real Recipe");
        assertThat(failures("empty")).isEqualTo(1.0);
    }

    @Test
    void noSeedsMeansNoWork() {
        assertThat(coordinator(props(2, 1000, 5000, 5)).scrape("x", List.of())).isEmpty();
        assertThat(coordinator(props(2, 1000, 5000, 5)).scrape("x", null)).isEmpty();
        assertThat(fetcher.fetchedUrls()).isEmpty();
    }

    @Test
    void searchAndScrapeNormalizesSearchResults() {
        fetcher.recipe(A, "From Redirect", "x").recipe(B, "Scheme Less", "x");
        WebSearchClient search = (text, limit) -> List.of(
                "//duckduckgo.com/l/?uddg=https%3A%2F%2Fsite.test%2Fa&rut=1",
                "site.test/b",
                "https://site.test/a");

        List<Candidate> results = coordinator(props(2, 1000, 5000, 5), search).searchAndScrape("x");

        assertThat(results).extracting(Candidate::title).containsExactly("From Redirect", "Scheme Less");
        assertThat(fetcher.fetchedUrls()).containsExactlyInAnyOrder(A, B);
    }

    @Test
    void unavailableSearchYieldsNoCandidates() {
        WebSearchClient search = (text, limit) -> {
            throw new SearchUnavailableException("search is down");
        };

        List<Candidate> results = coordinator(props(2, 1000, 5000, 5), search).searchAndScrape("x");

        assertThat(results).isEmpty();
        assertThat(registry.find("culinara.query.source.unavailable").tag("source", "web-search").counter())
                .isNotNull();
    }
}
