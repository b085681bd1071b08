package com.phillippitts.culinara.service.rank;

import com.phillippitts.culinara.domain.Candidate;
import com.phillippitts.culinara.domain.Provenance;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.phillippitts.culinara.testutil.Candidates.db;
import static com.phillippitts.culinara.testutil.Candidates.web;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateRankerTest {

    @Test
    void ordersByScoreDescendingAndAssignsRanks() {
        CandidateRanker ranker = new CandidateRanker(5);

        List<Candidate> ranked = ranker.merge(
                List.of(db("Low", 0.40), db("High", 0.90)),
                List.of(web("Middle", 0.60)));

        assertThat(ranked).extracting(Candidate::title).containsExactly("High", "Middle", "Low");
        assertThat(ranked).extracting(Candidate::rank).containsExactly(1, 2, 3);
    }

    @Test
    void databaseWinsScoreTies() {
        CandidateRanker ranker = new CandidateRanker(5);

        List<Candidate> ranked = ranker.merge(List.of(db("From Store", 0.7)), List.of(web("From Web", 0.7)));

        assertThat(ranked).extracting(Candidate::provenance)
                .containsExactly(Provenance.FROM_DATABASE, Provenance.FROM_WEB);
    }

    @Test
    void remainingTiesKeepDiscoveryOrder() {
        CandidateRanker ranker = new CandidateRanker(5);

        List<Candidate> ranked = ranker.merge(List.of(),
                List.of(web("First", 0.5), web("Second", 0.5), web("Third", 0.5)));

        assertThat(ranked).extracting(Candidate::title).containsExactly("First", "Second", "Third");
    }

    @Test
    void duplicateTitlesKeepTheDatabaseCopyEvenWhenWebScoresHigher() {
        CandidateRanker ranker = new CandidateRanker(5);

        List<Candidate> ranked = ranker.merge(
                List.of(db("Chicken Curry", 0.50)),
                List.of(web("  chicken   CURRY ", 0.95)));

        assertThat(ranked).hasSize(1);
        assertThat(ranked.get(0).provenance()).isEqualTo(Provenance.FROM_DATABASE);
        assertThat(ranked.get(0).score()).isEqualTo(0.50);
    }

    @Test
    void duplicatesWithinOneSourceKeepTheHigherScore() {
        CandidateRanker ranker = new CandidateRanker(5);

        List<Candidate> ranked = ranker.merge(List.of(),
                List.of(web("Pad Thai", 0.3), web("pad thai", 0.8), web("Pad Thai", 0.8)));

        assertThat(ranked).hasSize(1);
        assertThat(ranked.get(0).score()).isEqualTo(0.8);
        assertThat(ranked.get(0).title()).isEqualTo("pad thai");
    }

    @Test
    void truncatesToResultCap() {
        CandidateRanker ranker = new CandidateRanker(2);

        List<Candidate> ranked = ranker.merge(
                List.of(db("A", 0.9), db("B", 0.8), db("C", 0.7)),
                List.of(web("D", 0.95)));

        assertThat(ranked).extracting(Candidate::title).containsExactly("D", "A");
        assertThat(ranked).extracting(Candidate::rank).containsExactly(1, 2);
    }

    @Test
    void rejectedCandidatesNeverTakeASlot() {
        CandidateRanker ranker = new CandidateRanker(2);

        List<Candidate> ranked = ranker.merge(
                List.of(db("Beef Stew", 0.99, "beef"), db("Lentil Soup", 0.5, "lentils")),
                List.of(web("Veggie Chili", 0.4, "beans")),
                c -> !c.ingredients().contains("beef"));

        assertThat(ranked).extracting(Candidate::title).containsExactly("Lentil Soup", "Veggie Chili");
    }

    @Test
    void rejectedDatabaseCopyDoesNotShadowAnAdmittedWebCopy() {
        CandidateRanker ranker = new CandidateRanker(5);

        List<Candidate> ranked = ranker.merge(
                List.of(db("Curry", 0.9, "chicken")),
                List.of(web("Curry", 0.6, "chickpeas")),
                c -> !c.ingredients().contains("chicken"));

        assertThat(ranked).singleElement()
                .extracting(Candidate::provenance).isEqualTo(Provenance.FROM_WEB);
    }

    @Test
    void handlesNullAndEmptyInputs() {
        CandidateRanker ranker = new CandidateRanker(3);

        assertThat(ranker.merge(null, null)).isEmpty();
        assertThat(ranker.merge(List.of(), List.of())).isEmpty();
    }

    @Test
    void inputCandidatesAreNotModified() {
        CandidateRanker ranker = new CandidateRanker(3);
        Candidate original = db("Soup", 0.5);

        ranker.merge(List.of(original), List.of());

        assertThat(original.rank()).isZero();
    }

    @Test
    void rejectsNonPositiveCap() {
        assertThatThrownBy(() -> new CandidateRanker(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
