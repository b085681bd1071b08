package com.phillippitts.culinara.presentation.controller;

import com.phillippitts.culinara.domain.Preferences;
import com.phillippitts.culinara.domain.Query;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * JSON body of {@code POST /api/query}.
 *
 * @param query      free-text query
 * @param diets      diet labels such as "Vegan" or "Low Carb"
 * @param skillLevel cooking skill level
 * @param servings   requested servings
 * @param goal       free-text goal
 */
record QueryRequest(
        @NotBlank @Size(max = 1000) String query,
        List<String> diets,
        String skillLevel,
        @Positive Integer servings,
        String goal
) {

    Query toQuery() {
        List<String> labels = diets == null ? List.of() : diets.stream().filter(d -> d != null && !d.isBlank()).toList();
        return new Query(query, new Preferences(new LinkedHashSet<>(labels), skillLevel, servings, goal));
    }
}
