package com.phillippitts.culinara.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Utility for tokenizing text into normalized alpha tokens.
 *
 * <p>Tokenization rules:
 * <ul>
 *   <li>Split on non-alphabetic characters (regex: [^\p{Alpha}]+)</li>
 *   <li>Convert all tokens to lowercase</li>
 *   <li>Filter out blank tokens</li>
 *   <li>Return immutable list</li>
 * </ul>
 *
 * <p>{@link #terms(String)} additionally drops stop words and recipe filler words so that
 * "easy chicken recipes for dinner" yields {@code [chicken, dinner]}.
 */
public final class TokenizerUtil {

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "the", "for", "with", "of", "to", "in", "on", "or", "my", "me",
            "i", "is", "it", "some", "any", "that", "this", "what", "how", "can", "you", "please",
            "want", "make", "give", "show", "find", "recipe", "recipes", "easy", "quick", "best",
            "good", "simple", "healthy", "tonight", "something");

    private TokenizerUtil() {
        // Prevent instantiation
    }

    /**
     * Tokenizes text into normalized alpha tokens.
     *
     * @param text input text to tokenize (may be null or blank)
     * @return immutable list of lowercase alpha tokens (empty if no valid tokens)
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] parts = text.toLowerCase(Locale.ROOT).split("[^\\p{Alpha}]+");
        List<String> tokens = new ArrayList<>();
        for (String part : parts) {
            if (!part.isBlank()) {
                tokens.add(part);
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Distinct content terms of a query, in first-seen order, with stop words removed.
     *
     * @param text query text (may be null)
     * @return immutable ordered set of terms
     */
    public static Set<String> terms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        for (String token : tokenize(text)) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        return Collections.unmodifiableSet(terms);
    }

    /**
     * Lower-cases, collapses runs of whitespace and trims. Used as the dedup key for titles.
     */
    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        return title.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }
}
