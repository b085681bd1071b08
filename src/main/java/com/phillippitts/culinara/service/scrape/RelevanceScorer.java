package com.phillippitts.culinara.service.scrape;

import com.phillippitts.culinara.util.TokenizerUtil;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores a scraped recipe against the query by keyword overlap.
 *
 * <p>score = |query terms found in title or ingredients| / |query terms|, where a term also
 * matches its plural. Title hits count in full, ingredient-only hits count
 * {@value #INGREDIENT_WEIGHT}. The result is in [0,1]; a query without content terms scores 0.
 */
public final class RelevanceScorer {

    static final double INGREDIENT_WEIGHT = 0.75;

    /**
     * @param queryTerms  content terms of the query, see {@link TokenizerUtil#terms(String)}
     * @param title       recipe title
     * @param ingredients ingredient lines
     * @return relevance in [0,1]
     */
    public double score(Set<String> queryTerms, String title, List<String> ingredients) {
        if (queryTerms == null || queryTerms.isEmpty()) {
            return 0.0;
        }
        Set<String> titleTokens = new HashSet<>(TokenizerUtil.tokenize(title));
        Set<String> ingredientTokens = new HashSet<>();
        if (ingredients != null) {
            for (String line : ingredients) {
                ingredientTokens.addAll(TokenizerUtil.tokenize(line));
            }
        }

        double hits = 0.0;
        for (String term : queryTerms) {
            if (matches(titleTokens, term)) {
                hits += 1.0;
            } else if (matches(ingredientTokens, term)) {
                hits += INGREDIENT_WEIGHT;
            }
        }
        return Math.min(1.0, hits / queryTerms.size());
    }

    private static boolean matches(Set<String> tokens, String term) {
        return tokens.contains(term) || tokens.contains(term + "s") || tokens.contains(term + "es")
                || (term.endsWith("s") && tokens.contains(term.substring(0, term.length() - 1)))
                || (term.endsWith("es") && tokens.contains(term.substring(0, term.length() - 2)));
    }
}
