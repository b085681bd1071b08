package com.phillippitts.culinara.service.rank;

import com.phillippitts.culinara.domain.Candidate;
import com.phillippitts.culinara.util.TokenizerUtil;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Merges database and web candidates into one ranked, deduplicated, truncated list.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>Drop candidates the admission predicate rejects (dietary filter).</li>
 *   <li>Deduplicate by normalized title (lower-case, whitespace collapsed, trimmed). A database
 *       copy always beats a web copy; within one source the higher score wins and ties keep the
 *       copy seen first.</li>
 *   <li>Sort by score descending, then provenance (database first), then discovery order
 *       (database list order, then web list order).</li>
 *   <li>Truncate to the result cap and assign ranks 1..n.</li>
 * </ol>
 *
 * <p>Pure function of its inputs; thread-safe.
 */
public final class CandidateRanker {

    private static final Comparator<Indexed> ORDER = Comparator
            .comparingDouble((Indexed e) -> e.candidate().score()).reversed()
            .thenComparing(e -> e.candidate().provenance())
            .thenComparingInt(Indexed::index);

    private final int resultCap;

    /**
     * @param resultCap maximum number of candidates returned (must be positive)
     * @throws IllegalArgumentException if resultCap is not positive
     */
    public CandidateRanker(int resultCap) {
        if (resultCap <= 0) {
            throw new IllegalArgumentException("resultCap must be positive, got: " + resultCap);
        }
        this.resultCap = resultCap;
    }

    public List<Candidate> merge(List<Candidate> database, List<Candidate> web) {
        return merge(database, web, c -> true);
    }

    /**
     * Merges, filters and ranks the two candidate lists.
     *
     * @param database candidates from the vector store, in store order (may be null)
     * @param web      candidates from the scrape stage, in discovery order (may be null)
     * @param admit    admission predicate applied before deduplication
     * @return at most {@code resultCap} ranked candidates, best first
     */
    public List<Candidate> merge(List<Candidate> database, List<Candidate> web, Predicate<Candidate> admit) {
        List<Indexed> discovered = new ArrayList<>();
        int index = 0;
        for (List<Candidate> source : sources(database, web)) {
            for (Candidate candidate : source) {
                if (candidate != null && admit.test(candidate)) {
                    discovered.add(new Indexed(candidate, index));
                }
                index++;
            }
        }

        Map<String, Indexed> byTitle = new LinkedHashMap<>();
        for (Indexed entry : discovered) {
            byTitle.merge(TokenizerUtil.normalizeTitle(entry.candidate().title()), entry,
                    CandidateRanker::preferred);
        }

        List<Indexed> ordered = new ArrayList<>(byTitle.values());
        ordered.sort(ORDER);

        List<Candidate> ranked = new ArrayList<>(Math.min(resultCap, ordered.size()));
        for (Indexed entry : ordered) {
            if (ranked.size() == resultCap) {
                break;
            }
            ranked.add(entry.candidate().withRank(ranked.size() + 1));
        }
        return List.copyOf(ranked);
    }

    public int resultCap() {
        return resultCap;
    }

    private static Indexed preferred(Indexed kept, Indexed incoming) {
        Candidate a = kept.candidate();
        Candidate b = incoming.candidate();
        if (a.provenance() != b.provenance()) {
            return a.fromDatabase() ? kept : incoming;
        }
        return b.score() > a.score() ? incoming : kept;
    }

    private static List<List<Candidate>> sources(List<Candidate> database, List<Candidate> web) {
        return List.of(database == null ? List.of() : database, web == null ? List.of() : web);
    }

    private record Indexed(Candidate candidate, int index) {
    }
}
