package com.phillippitts.culinara.domain;

import java.util.Set;

/**
 * Optional structured preferences attached to a query.
 *
 * @param diets      requested diet labels as the caller sent them (e.g. "Low Carb", "vegan")
 * @param skillLevel cooking skill level (beginner, intermediate, advanced), or null
 * @param servings   requested serving count, or null
 * @param goal       free-text goal (e.g. "high protein"), or null
 */
public record Preferences(
        Set<String> diets,
        String skillLevel,
        Integer servings,
        String goal
) {

    public static final Preferences NONE = new Preferences(Set.of(), null, null, null);

    public Preferences {
        diets = diets == null ? Set.of() : Set.copyOf(diets);
    }

    public static Preferences diets(String... labels) {
        return new Preferences(Set.of(labels), null, null, null);
    }
}
