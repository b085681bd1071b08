package com.phillippitts.culinara.domain;

import java.util.List;
import java.util.Objects;

/**
 * Result of answering a recipe query. Always structurally valid: "nothing found" is an empty
 * candidate list, "results but no narrative" is a non-empty list with an empty narrative.
 *
 * @param narrative       generated summary, empty string when every provider failed (never null)
 * @param candidates      ranked candidates, best first
 * @param facts           generated trivia facts, possibly empty
 * @param provenance      which sources were consulted
 * @param degradedLatency true when the request overran its soft deadline
 * @param elapsedMs       wall-clock time spent answering
 */
public record QueryResponse(
        String narrative,
        List<Candidate> candidates,
        List<String> facts,
        SourceProvenance provenance,
        boolean degradedLatency,
        long elapsedMs
) {

    public QueryResponse {
        narrative = narrative == null ? "" : narrative;
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        facts = facts == null ? List.of() : List.copyOf(facts);
        Objects.requireNonNull(provenance, "provenance must not be null");
    }

    public static QueryResponse empty(SourceProvenance provenance, long elapsedMs) {
        return new QueryResponse("", List.of(), List.of(), provenance, false, elapsedMs);
    }

    public boolean hasCandidates() {
        return !candidates.isEmpty();
    }

    public QueryResponse withTiming(boolean degraded, long elapsed) {
        return new QueryResponse(narrative, candidates, facts, provenance, degraded, elapsed);
    }
}
