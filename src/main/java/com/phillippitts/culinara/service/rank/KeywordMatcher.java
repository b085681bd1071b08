package com.phillippitts.culinara.service.rank;

import com.phillippitts.culinara.util.TokenizerUtil;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a database record against the ingredients a query names explicitly.
 *
 * <p>When the query names a main ingredient ("paneer tikka"), a record that does not mention it,
 * or that mentions a conflicting one ("chicken" vs "tofu"), is not a valid match however close its
 * embedding is. Valid records earn a small boost for every query term they contain, capped at
 * {@value #MAX_BOOST}.
 */
public final class KeywordMatcher {

    static final double TERM_BOOST = 0.03;
    static final double MAX_BOOST = 0.15;

    private static final Set<String> MAIN_INGREDIENTS = Set.of(
            "chicken", "beef", "pork", "lamb", "fish", "salmon", "tuna", "shrimp", "prawn",
            "paneer", "tofu", "tempeh", "seitan",
            "cheese", "mozzarella", "cheddar", "feta", "ricotta",
            "mushroom", "eggplant", "zucchini", "tomato", "potato", "onion", "garlic",
            "rice", "pasta", "noodle", "bread");

    private static final Map<String, List<String>> CONFLICTS = Map.of(
            "chicken", List.of("tofu", "paneer", "vegetarian", "vegan"),
            "paneer", List.of("chicken", "beef", "pork"),
            "tofu", List.of("chicken", "beef", "pork"));

    /**
     * Outcome of the check.
     *
     * @param valid false when a named ingredient is missing or a conflicting one is present
     * @param boost score boost for matched query terms, 0 when invalid
     */
    public record Match(boolean valid, double boost) {
        static final Match REJECTED = new Match(false, 0.0);
    }

    /**
     * @param queryText   the user's query
     * @param title       record title
     * @param ingredients record ingredient lines
     */
    public Match evaluate(String queryText, String title, List<String> ingredients) {
        Set<String> recordTokens = new HashSet<>(TokenizerUtil.tokenize(title));
        if (ingredients != null) {
            for (String line : ingredients) {
                recordTokens.addAll(TokenizerUtil.tokenize(line));
            }
        }
        Set<String> terms = TokenizerUtil.terms(queryText);
        List<String> named = new ArrayList<>();
        for (String term : terms) {
            String singular = singular(term);
            if (MAIN_INGREDIENTS.contains(singular)) {
                named.add(singular);
            }
        }
        for (String ingredient : named) {
            for (String conflict : CONFLICTS.getOrDefault(ingredient, List.of())) {
                if (mentions(recordTokens, conflict)) {
                    return Match.REJECTED;
                }
            }
        }
        for (String ingredient : named) {
            if (!mentions(recordTokens, ingredient)) {
                return Match.REJECTED;
            }
        }
        int hits = 0;
        for (String term : terms) {
            if (mentions(recordTokens, singular(term))) {
                hits++;
            }
        }
        return new Match(true, Math.min(MAX_BOOST, hits * TERM_BOOST));
    }

    private static boolean mentions(Set<String> tokens, String word) {
        return tokens.contains(word) || tokens.contains(word + "s") || tokens.contains(word + "es");
    }

    private static String singular(String term) {
        if (term.endsWith("oes")) {
            return term.substring(0, term.length() - 2);
        }
        if (term.endsWith("s") && !term.endsWith("ss") && term.length() > 3) {
            return term.substring(0, term.length() - 1);
        }
        return term;
    }
}
