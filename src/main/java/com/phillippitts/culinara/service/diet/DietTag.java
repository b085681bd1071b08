package com.phillippitts.culinara.service.diet;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Diets a caller can request. Labels arrive as free text from the UI ("Low Carb", "non-veg",
 * "gluten_free") and are parsed leniently by {@link #fromLabel(String)}.
 */
public enum DietTag {
    VEGAN,
    VEGETARIAN,
    NON_VEGETARIAN,
    KETO,
    LOW_CARB,
    GLUTEN_FREE,
    DAIRY_FREE,
    PALEO;

    private static final Map<String, DietTag> ALIASES = Map.ofEntries(
            Map.entry("vegan", VEGAN),
            Map.entry("plantbased", VEGAN),
            Map.entry("vegetarian", VEGETARIAN),
            Map.entry("veg", VEGETARIAN),
            Map.entry("veggie", VEGETARIAN),
            Map.entry("nonvegetarian", NON_VEGETARIAN),
            Map.entry("nonveg", NON_VEGETARIAN),
            Map.entry("meat", NON_VEGETARIAN),
            Map.entry("omnivore", NON_VEGETARIAN),
            Map.entry("keto", KETO),
            Map.entry("ketogenic", KETO),
            Map.entry("lowcarb", LOW_CARB),
            Map.entry("glutenfree", GLUTEN_FREE),
            Map.entry("gf", GLUTEN_FREE),
            Map.entry("dairyfree", DAIRY_FREE),
            Map.entry("lactosefree", DAIRY_FREE),
            Map.entry("paleo", PALEO)
    );

    /**
     * Parses a diet label, ignoring case, spaces, hyphens and underscores.
     *
     * @param label caller-supplied label, may be null
     * @return the matching tag, or empty when the label is not recognised
     */
    public static Optional<DietTag> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String key = label.toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-]+", "");
        return Optional.ofNullable(ALIASES.get(key));
    }
}
