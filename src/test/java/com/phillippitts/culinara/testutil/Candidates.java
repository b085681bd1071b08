package com.phillippitts.culinara.testutil;

import com.phillippitts.culinara.domain.Candidate;
import com.phillippitts.culinara.domain.Provenance;
import com.phillippitts.culinara.domain.RecipeFacts;

import java.util.Arrays;
import java.util.List;

/** Short-hand factories for candidates in tests. */
public final class Candidates {

    private Candidates() {
    }

    public static Candidate db(String title, double score, String... ingredients) {
        return Candidate.of(title, Arrays.asList(ingredients), List.of("Cook it."), "db-" + title.hashCode(),
                RecipeFacts.EMPTY, score, Provenance.FROM_DATABASE);
    }

    public static Candidate web(String title, double score, String... ingredients) {
        return Candidate.of(title, Arrays.asList(ingredients), List.of("Cook it."),
                "https://example.com/" + title.toLowerCase().replace(' ', '-'), RecipeFacts.EMPTY, score,
                Provenance.FROM_WEB);
    }
}
