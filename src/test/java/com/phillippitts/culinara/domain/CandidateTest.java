package com.phillippitts.culinara.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateTest {

    @Test
    void shouldRejectScoreOutsideUnitInterval() {
        assertThatThrownBy(() -> Candidate.of("Soup", List.of(), List.of(), "r1", null, 1.2, Provenance.FROM_DATABASE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1.2");
        assertThatThrownBy(() -> Candidate.of("Soup", List.of(), List.of(), "r1", null, Double.NaN, Provenance.FROM_WEB))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectMissingTitle() {
        assertThatThrownBy(() -> Candidate.of(null, List.of(), List.of(), "r1", null, 0.5, Provenance.FROM_DATABASE))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldCopyListsAndDefaultFacts() {
        List<String> ingredients = new ArrayList<>(List.of("water"));
        Candidate candidate = Candidate.of("Soup", ingredients, null, "r1", null, 0.5, Provenance.FROM_DATABASE);

        ingredients.add("salt");

        assertThat(candidate.ingredients()).containsExactly("water");
        assertThat(candidate.instructions()).isEmpty();
        assertThat(candidate.facts()).isEqualTo(RecipeFacts.EMPTY);
        assertThat(candidate.rank()).isZero();
    }

    @Test
    void withRankReturnsRankedCopy() {
        Candidate candidate = Candidate.of("Soup", List.of(), List.of(), "https://example.com/soup", null, 0.5,
                Provenance.FROM_WEB);

        Candidate ranked = candidate.withRank(2);

        assertThat(ranked.rank()).isEqualTo(2);
        assertThat(candidate.rank()).isZero();
        assertThat(ranked.fromDatabase()).isFalse();
        assertThatThrownBy(() -> candidate.withRank(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
