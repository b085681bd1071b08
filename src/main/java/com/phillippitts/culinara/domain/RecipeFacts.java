package com.phillippitts.culinara.domain;

import java.util.Map;

/**
 * Structured facts attached to a recipe. Every field is optional; times are kept as the source
 * reports them (ISO-8601 durations from JSON-LD, or free text such as "25 mins").
 *
 * @param prepTime  preparation time, or null
 * @param cookTime  cooking time, or null
 * @param totalTime total time, or null
 * @param servings  servings or yield, or null
 * @param nutrition nutrition values keyed by name (e.g. "calories"), never null
 */
public record RecipeFacts(
        String prepTime,
        String cookTime,
        String totalTime,
        String servings,
        Map<String, String> nutrition
) {

    public static final RecipeFacts EMPTY = new RecipeFacts(null, null, null, null, Map.of());

    public RecipeFacts {
        nutrition = nutrition == null ? Map.of() : Map.copyOf(nutrition);
    }
}
