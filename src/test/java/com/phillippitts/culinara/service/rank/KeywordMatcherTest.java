package com.phillippitts.culinara.service.rank;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class KeywordMatcherTest {

    private final KeywordMatcher matcher = new KeywordMatcher();

    @Test
    void recordMissingANamedMainIngredientIsRejected() {
        KeywordMatcher.Match match = matcher.evaluate("paneer tikka", "Chicken Tikka", List.of("chicken", "yogurt"));

        assertThat(match.valid()).isFalse();
        assertThat(match.boost()).isZero();
    }

    @Test
    void conflictingIngredientIsRejected() {
        KeywordMatcher.Match match = matcher.evaluate("chicken stir fry", "Chicken and Tofu Stir Fry",
                List.of("chicken", "tofu", "soy sauce"));

        assertThat(match.valid()).isFalse();
    }

    @Test
    void matchingRecordEarnsBoostPerTerm() {
        KeywordMatcher.Match match = matcher.evaluate("chicken curry", "Chicken Curry",
                List.of("chicken thighs", "curry powder"));

        assertThat(match.valid()).isTrue();
        assertThat(match.boost()).isCloseTo(2 * KeywordMatcher.TERM_BOOST, within(1e-9));
    }

    @Test
    void boostIsCapped() {
        KeywordMatcher.Match match = matcher.evaluate(
                "spicy garlic ginger lemon chicken rice bowl with chilli",
                "Spicy Garlic Ginger Lemon Chicken Rice Bowl",
                List.of("chicken", "rice", "garlic", "ginger", "lemon", "chilli"));

        assertThat(match.valid()).isTrue();
        assertThat(match.boost()).isEqualTo(KeywordMatcher.MAX_BOOST);
    }

    @Test
    void pluralQueryTermsMatchSingularRecords() {
        KeywordMatcher.Match match = matcher.evaluate("roasted potatoes", "Roasted Potato Wedges", List.of("potato"));

        assertThat(match.valid()).isTrue();
    }

    @Test
    void queriesWithoutMainIngredientsAreAlwaysValid() {
        KeywordMatcher.Match match = matcher.evaluate("something warm for a rainy day", "Tomato Soup",
                List.of("tomatoes"));

        assertThat(match.valid()).isTrue();
        assertThat(match.boost()).isZero();
    }
}
