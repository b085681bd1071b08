package com.phillippitts.culinara.service.generation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits generated facts text into individual facts.
 *
 * <p>Lines are trimmed, leading bullets ("-", "*", "•") and numbering ("1.", "2)") are stripped,
 * blank lines are dropped and at most {@code max} facts are kept.
 */
public final class FactsParser {

    private static final Pattern PREFIX = Pattern.compile("^(?:[-*•]+|\\d+[.)])\\s*");

    private FactsParser() {
    }

    public static List<String> parse(String text, int max) {
        if (text == null || text.isBlank() || max <= 0) {
            return List.of();
        }
        List<String> facts = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String fact = PREFIX.matcher(line.strip()).replaceFirst("").strip();
            if (!fact.isEmpty()) {
                facts.add(fact);
                if (facts.size() == max) {
                    break;
                }
            }
        }
        return List.copyOf(facts);
    }
}
