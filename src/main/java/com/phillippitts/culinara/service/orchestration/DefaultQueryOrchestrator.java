package com.phillippitts.culinara.service.orchestration;

import com.phillippitts.culinara.config.properties.QueryProperties;
import com.phillippitts.culinara.domain.Candidate;
import com.phillippitts.culinara.domain.Query;
import com.phillippitts.culinara.domain.QueryResponse;
import com.phillippitts.culinara.domain.SourceProvenance;
import com.phillippitts.culinara.service.cache.ResponseCache;
import com.phillippitts.culinara.service.diet.DietaryFilter;
import com.phillippitts.culinara.service.orchestration.event.SlowQueryEvent;
import com.phillippitts.culinara.service.rank.CandidateRanker;
import com.phillippitts.culinara.service.scrape.ScrapeCoordinator;
import com.phillippitts.culinara.service.validation.QueryValidator;
import com.phillippitts.culinara.util.LogSanitizer;
import com.phillippitts.culinara.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Default implementation of {@link QueryOrchestrator}.
 *
 * <p>Thread-safe: per-query state lives in a local progress holder, and all collaborators
 * are stateless or internally synchronized. Build instances with {@link QueryOrchestratorBuilder}.
 */
public class DefaultQueryOrchestrator implements QueryOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultQueryOrchestrator.class);

    static final String OUTCOME_ANSWERED = "answered";
    static final String OUTCOME_EMPTY = "empty";
    static final String OUTCOME_ERROR = "error";

    private final QueryValidator validator;
    private final DatabaseCandidateSource database;
    private final ScrapeCoordinator scrapeCoordinator;
    private final DietaryFilter dietaryFilter;
    private final CandidateRanker ranker;
    private final NarrativeGenerator narrator;
    private final ResponseCache cache;
    private final QueryProperties props;
    private final ApplicationEventPublisher publisher;
    private final QueryMetricsPublisher metrics;

    DefaultQueryOrchestrator(QueryValidator validator,
                             DatabaseCandidateSource database,
                             ScrapeCoordinator scrapeCoordinator,
                             DietaryFilter dietaryFilter,
                             CandidateRanker ranker,
                             NarrativeGenerator narrator,
                             ResponseCache cache,
                             QueryProperties props,
                             ApplicationEventPublisher publisher,
                             QueryMetricsPublisher metrics) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.scrapeCoordinator = Objects.requireNonNull(scrapeCoordinator, "scrapeCoordinator must not be null");
        this.dietaryFilter = Objects.requireNonNull(dietaryFilter, "dietaryFilter must not be null");
        this.ranker = Objects.requireNonNull(ranker, "ranker must not be null");
        this.narrator = Objects.requireNonNull(narrator, "narrator must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public QueryResponse answer(Query query) {
        long t0 = System.nanoTime();
        validator.validate(query);

        String preview = LogSanitizer.query(query.text());
        Optional<QueryResponse> cached = cache.get(query);
        if (cached.isPresent()) {
            LOG.debug("Cache hit for query '{}'", preview);
            return cached.get().withTiming(false, TimeUtils.elapsedMillis(t0));
        }
        LOG.info("Answering query '{}' (diets={})", preview, query.preferences().diets());

        Progress progress = new Progress();
        QueryResponse response;
        String outcome;
        try {
            response = run(query, progress);
            outcome = response.hasCandidates() ? OUTCOME_ANSWERED : OUTCOME_EMPTY;
        } catch (RuntimeException e) {
            LOG.error("Query '{}' failed unexpectedly; returning {} gathered candidate(s)",
                    preview, progress.ranked.size(), e);
            response = new QueryResponse("", progress.ranked, List.of(), progress.provenance(), false, 0L);
            outcome = OUTCOME_ERROR;
        }

        long elapsedNanos = System.nanoTime() - t0;
        long elapsedMs = TimeUtils.nanosToMillis(elapsedNanos);
        boolean degraded = elapsedMs > props.getSoftDeadlineMs();
        if (degraded) {
            LOG.warn("Query '{}' took {} ms, over the {} ms soft deadline", preview, elapsedMs,
                    props.getSoftDeadlineMs());
            metrics.recordSlowQuery();
            publisher.publishEvent(new SlowQueryEvent(preview, elapsedMs, props.getSoftDeadlineMs(), Instant.now()));
        }
        response = response.withTiming(degraded, elapsedMs);
        metrics.recordQuery(outcome, elapsedNanos);
        if (!OUTCOME_ERROR.equals(outcome)) {
            cache.put(query, response);
        }
        LOG.info("Answered query '{}': outcome={}, candidates={}, db={}, web={}, {} ms", preview, outcome,
                response.candidates().size(), response.provenance().usedDatabase(),
                response.provenance().usedWeb(), elapsedMs);
        return response;
    }

    private QueryResponse run(Query query, Progress progress) {
        Predicate<Candidate> admit = dietaryFilter.admitting(query.preferences().diets());

        DatabaseCandidateSource.Result db = database.search(query.text());
        progress.usedDatabase = db.available();
        long admittedDb = db.candidates().stream().filter(admit).count();

        List<Candidate> ranked = ranker.merge(db.candidates(), List.of(), admit);
        progress.ranked = ranked;
        if (admittedDb < props.getMinDatabaseCandidates()) {
            LOG.debug("{} diet-compatible store candidate(s), below {}; trying the web", admittedDb,
                    props.getMinDatabaseCandidates());
            progress.usedWeb = true;
            metrics.recordSourceUsed("web");
            List<Candidate> web = scrapeCoordinator.searchAndScrape(query.text());
            ranked = ranker.merge(db.candidates(), web, admit);
            progress.ranked = ranked;
        }

        if (ranked.isEmpty()) {
            return QueryResponse.empty(progress.provenance(), 0L);
        }

        NarrativeGenerator.Narrative narrative = narrator.narrate(query, ranked);
        return new QueryResponse(narrative.summary(), ranked, narrative.facts(), progress.provenance(), false, 0L);
    }

    /** What one query has gathered so far; read by the failure path. */
    private static final class Progress {
        private boolean usedDatabase;
        private boolean usedWeb;
        private List<Candidate> ranked = List.of();

        SourceProvenance provenance() {
            return new SourceProvenance(usedDatabase, usedWeb);
        }
    }
}
