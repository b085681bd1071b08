package com.phillippitts.culinara.service.scrape;

import com.phillippitts.culinara.config.properties.ScrapeProperties;
import com.phillippitts.culinara.domain.Candidate;
import com.phillippitts.culinara.domain.Provenance;
import com.phillippitts.culinara.domain.ScrapeTask;
import com.phillippitts.culinara.exception.FetchTimeoutException;
import com.phillippitts.culinara.exception.SearchUnavailableException;
import com.phillippitts.culinara.service.orchestration.QueryMetricsPublisher;
import com.phillippitts.culinara.service.source.FetchedPage;
import com.phillippitts.culinara.service.source.PageFetcher;
import com.phillippitts.culinara.service.source.WebSearchClient;
import com.phillippitts.culinara.util.LogSanitizer;
import com.phillippitts.culinara.util.TimeUtils;
import com.phillippitts.culinara.util.TokenizerUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default scrape stage: a bounded, non-blocking fan-out over a task queue.
 *
 * <p><b>Thread Model:</b> every call to {@link #scrape(String, List)} creates a stage with its own
 * task queue and an in-flight window of {@code concurrency} slots. Starting a task takes a slot
 * and calls {@link PageFetcher#fetch(String)}; the returned future is bounded by the per-task
 * timeout and its completion frees the slot and starts the next queued task. No thread waits on
 * a fetch: completed pages are processed on the {@code scrapeExecutor}, and only the calling
 * thread blocks, for at most the stage budget. Timed-out fetches are cancelled.
 *
 * <p><b>Expansion:</b> collection pages at depth 0 have up to {@code max-expansion-links} links
 * queued at depth 1; collection pages at depth 1 are dropped. A URL is fetched at most once per
 * stage. Title and URL heuristics only mark a page as a collection when it carries no recipe
 * content of its own.
 *
 * <p><b>Budget:</b> on exhaustion the stage is closed, in-flight fetches are cancelled, whatever
 * already completed is returned and late results are discarded.
 *
 * <p><b>Ordering:</b> results are sorted by discovery position (seed order, with links expanded
 * from a collection page taking that page's slot), independent of completion order.
 */
@Service
public class DefaultScrapeCoordinator implements ScrapeCoordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultScrapeCoordinator.class);

    private static final int URL_PREVIEW = 120;

    private final WebSearchClient search;
    private final PageFetcher fetcher;
    private final Executor executor;
    private final ScrapeProperties properties;
    private final QueryMetricsPublisher metrics;
    private final CollectionPageDetector collectionDetector = new CollectionPageDetector();
    private final RelevanceScorer scorer = new RelevanceScorer();

    public DefaultScrapeCoordinator(WebSearchClient search,
                                    PageFetcher fetcher,
                                    @Qualifier("scrapeExecutor") Executor executor,
                                    ScrapeProperties properties,
                                    QueryMetricsPublisher metrics) {
        this.search = Objects.requireNonNull(search);
        this.fetcher = Objects.requireNonNull(fetcher);
        this.executor = Objects.requireNonNull(executor);
        this.properties = Objects.requireNonNull(properties);
        this.metrics = metrics == null ? QueryMetricsPublisher.NOOP : metrics;
    }

    @Override
    public List<Candidate> searchAndScrape(String queryText) {
        List<String> seeds;
        try {
            seeds = UrlNormalizer.normalizeAll(search.search(queryText, properties.getSeedLimit()));
        } catch (SearchUnavailableException e) {
            LOG.warn("Web search unavailable: {}", e.getMessage());
            metrics.recordSourceUnavailable(SearchUnavailableException.SOURCE);
            return List.of();
        }
        if (seeds.size() > properties.getSeedLimit()) {
            seeds = seeds.subList(0, properties.getSeedLimit());
        }
        LOG.debug("Web search returned {} seed URL(s)", seeds.size());
        return scrape(queryText, seeds);
    }

    @Override
    public List<Candidate> scrape(String queryText, List<String> seedUrls) {
        if (seedUrls == null || seedUrls.isEmpty()) {
            return List.of();
        }
        long t0 = System.nanoTime();
        Stage stage = new Stage(TokenizerUtil.terms(queryText), properties.getConcurrency());
        for (int i = 0; i < seedUrls.size(); i++) {
            String url = seedUrls.get(i);
            if (url != null && !url.isBlank()) {
                stage.offer(new QueuedTask(ScrapeTask.seed(url), i, -1));
            }
        }
        if (stage.isFinished()) {
            return List.of();
        }

        pump(stage);

        long budgetMs = properties.getStageBudgetMs();
        try {
            stage.done.get(TimeUtils.remainingMillis(t0, budgetMs), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Scrape stage budget of {} ms exhausted; returning {} completed page(s)",
                    budgetMs, stage.completedCount());
            metrics.recordScrapeBudgetExhausted();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Scrape stage interrupted; returning {} completed page(s)", stage.completedCount());
        } catch (ExecutionException ee) {
            LOG.error("Scrape stage failed unexpectedly", ee.getCause());
        }

        List<Candidate> results = stage.close();
        LOG.info("Scrape stage finished: {} candidate(s) from {} seed(s) in {} ms",
                results.size(), seedUrls.size(), TimeUtils.elapsedMillis(t0));
        return results;
    }

    /**
     * Starts queued tasks while the stage has free slots.
     */
    private void pump(Stage stage) {
        for (QueuedTask task : stage.claim()) {
            start(stage, task);
        }
    }

    private void start(Stage stage, QueuedTask queued) {
        String url = queued.task().url();
        CompletableFuture<FetchedPage> fetched;
        try {
            fetched = fetcher.fetch(url);
        } catch (RuntimeException e) {
            LOG.warn("Fetch of {} failed: {}", LogSanitizer.truncate(url, URL_PREVIEW), e.getMessage());
            metrics.recordScrapeFailure("error");
            finish(stage);
            return;
        }
        stage.inFlight.put(queued, fetched);
        fetched.copy()
                .orTimeout(properties.getPerTaskTimeoutMs(), TimeUnit.MILLISECONDS)
                .whenComplete((page, error) -> dispatch(stage, queued, fetched, page, error));
    }

    private void dispatch(Stage stage, QueuedTask queued, CompletableFuture<FetchedPage> fetched,
                          FetchedPage page, Throwable error) {
        Runnable completion = () -> onFetched(stage, queued, fetched, page, error);
        try {
            executor.execute(completion);
        } catch (RejectedExecutionException e) {
            completion.run();
        }
    }

    private void onFetched(Stage stage, QueuedTask queued, CompletableFuture<FetchedPage> fetched,
                           FetchedPage page, Throwable error) {
        stage.inFlight.remove(queued);
        String url = LogSanitizer.truncate(queued.task().url(), URL_PREVIEW);
        try {
            if (stage.isClosed()) {
                LOG.debug("Discarding late result for {}", url);
            } else if (error != null) {
                recordFailure(url, fetched, error);
            } else if (page != null) {
                process(stage, queued, page);
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected error scraping {}", url, e);
            metrics.recordScrapeFailure("error");
        } finally {
            finish(stage);
        }
    }

    private void finish(Stage stage) {
        stage.taskDone();
        if (!stage.isClosed()) {
            pump(stage);
        }
    }

    private void recordFailure(String url, CompletableFuture<FetchedPage> fetched, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            fetched.cancel(true);
            LOG.warn("Fetch of {} timed out after {} ms", url, properties.getPerTaskTimeoutMs());
            metrics.recordScrapeFailure("timeout");
            return;
        }
        LOG.warn("Fetch of {} failed: {}", url, cause.getMessage());
        metrics.recordScrapeFailure(cause instanceof FetchTimeoutException ? "timeout" : "error");
    }

    private void process(Stage stage, QueuedTask queued, FetchedPage page) {
        ScrapeTask task = queued.task();
        boolean listing = page.collection()
                || (!page.hasRecipeContent() && collectionDetector.isCollection(page.url(), page.title()));
        if (listing) {
            expand(stage, queued, page);
            return;
        }
        if (page.isBlank()) {
            LOG.debug("Skipping empty page {}", LogSanitizer.truncate(task.url(), URL_PREVIEW));
            metrics.recordScrapeFailure("empty");
            return;
        }
        double score = scorer.score(stage.queryTerms, page.title(), page.ingredients());
        String sourceId = page.url() == null || page.url().isBlank() ? task.url() : page.url();
        String title = page.title().isBlank() ? sourceId : page.title();
        Candidate candidate = Candidate.of(title, page.ingredients(), page.instructions(), sourceId,
                page.facts(), score, Provenance.FROM_WEB);
        stage.complete(queued, candidate);
    }

    private void expand(Stage stage, QueuedTask parent, FetchedPage page) {
        if (!parent.task().canExpand()) {
            LOG.debug("Dropping nested collection page {}", LogSanitizer.truncate(page.url(), URL_PREVIEW));
            metrics.recordScrapeFailure("depth-cap");
            return;
        }
        List<String> links = UrlNormalizer.normalizeAll(page.links());
        int limit = Math.min(links.size(), properties.getMaxExpansionLinks());
        int queued = 0;
        for (int i = 0; i < limit; i++) {
            if (stage.offer(new QueuedTask(parent.task().child(links.get(i)), parent.seedIndex(), i))) {
                queued++;
            }
        }
        LOG.debug("Expanded collection page {} into {} link(s)",
                LogSanitizer.truncate(page.url(), URL_PREVIEW), queued);
    }

    /** A task plus its discovery position: seed index, then link index (-1 for the seed itself). */
    private record QueuedTask(ScrapeTask task, int seedIndex, int linkIndex) {
    }

    private record Found(QueuedTask origin, Candidate candidate) {
    }

    private static final Comparator<Found> DISCOVERY_ORDER = Comparator
            .comparingInt((Found f) -> f.origin().seedIndex())
            .thenComparingInt(f -> f.origin().linkIndex());

    /**
     * Per-call state shared by fetch completions. The queue, the in-flight map, the visited set,
     * the result collection and the counters are touched concurrently; slot accounting is guarded
     * by the stage monitor.
     */
    private static final class Stage {
        private final Set<String> queryTerms;
        private final int width;
        private final Queue<QueuedTask> queue = new ConcurrentLinkedQueue<>();
        private final Map<QueuedTask, CompletableFuture<FetchedPage>> inFlight = new ConcurrentHashMap<>();
        private final Set<String> visited = ConcurrentHashMap.newKeySet();
        private final ConcurrentLinkedQueue<Found> results = new ConcurrentLinkedQueue<>();
        private final CompletableFuture<Void> done = new CompletableFuture<>();
        // Incremented on enqueue, decremented once a task (including any children it queued) is done.
        private final AtomicInteger outstanding = new AtomicInteger();
        private int running;
        private volatile boolean closed;

        Stage(Set<String> queryTerms, int width) {
            this.queryTerms = queryTerms;
            this.width = width;
        }

        boolean offer(QueuedTask task) {
            if (closed || !visited.add(task.task().url())) {
                return false;
            }
            outstanding.incrementAndGet();
            queue.add(task);
            return true;
        }

        synchronized List<QueuedTask> claim() {
            List<QueuedTask> claimed = new ArrayList<>();
            while (!closed && running < width) {
                QueuedTask next = queue.poll();
                if (next == null) {
                    break;
                }
                running++;
                claimed.add(next);
            }
            return claimed;
        }

        void taskDone() {
            synchronized (this) {
                running--;
            }
            if (outstanding.decrementAndGet() == 0) {
                done.complete(null);
            }
        }

        void complete(QueuedTask origin, Candidate candidate) {
            if (!closed) {
                results.add(new Found(origin, candidate));
            }
        }

        boolean isFinished() {
            return outstanding.get() == 0;
        }

        boolean isClosed() {
            return closed;
        }

        int completedCount() {
            return results.size();
        }

        List<Candidate> close() {
            closed = true;
            queue.clear();
            inFlight.values().forEach(f -> f.cancel(true));
            List<Found> snapshot = new ArrayList<>(results);
            snapshot.sort(DISCOVERY_ORDER);
            List<Candidate> candidates = new ArrayList<>(snapshot.size());
            for (Found found : snapshot) {
                candidates.add(found.candidate());
            }
            return List.copyOf(candidates);
        }
    }
}
