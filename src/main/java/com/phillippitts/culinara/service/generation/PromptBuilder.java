package com.phillippitts.culinara.service.generation;

import com.phillippitts.culinara.domain.Candidate;
import com.phillippitts.culinara.domain.Preferences;
import com.phillippitts.culinara.domain.Query;
import com.phillippitts.culinara.domain.RecipeFacts;

import java.util.List;

/**
 * Builds the summary and facts prompts sent through the generation chain.
 *
 * <p>The recipe context is capped ({@value #MAX_RECIPES} recipes, {@value #MAX_INGREDIENTS}
 * ingredients and {@value #MAX_STEPS} steps each) to keep prompts small.
 */
public final class PromptBuilder {

    static final int MAX_RECIPES = 3;
    static final int MAX_INGREDIENTS = 15;
    static final int MAX_STEPS = 8;

    /**
     * Prompt asking for a short conversational summary of the ranked recipes.
     */
    public String summaryPrompt(Query query, List<Candidate> ranked) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("A user asked: \"").append(query.text()).append("\"\n");
        appendPreferences(sb, query.preferences());
        sb.append("\nI found these recipes:\n\n");
        appendRecipes(sb, ranked);
        sb.append("""
                Instructions:
                - Summarize the recipes in a clear, conversational way
                - Include key details like ingredients, cooking time and main steps
                - Only mention ingredients that appear above; do not invent any
                - For recipes found online, cite the source URL
                - Highlight what is most relevant to the user's request
                """);
        return sb.toString();
    }

    /**
     * Prompt asking for {@code count} short trivia facts, one per line.
     */
    public String factsPrompt(Query query, List<Candidate> ranked, int count) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("A user asked: \"").append(query.text()).append("\"\n\n");
        sb.append("Recipes: ");
        int n = Math.min(MAX_RECIPES, ranked.size());
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                sb.append("; ");
            }
            sb.append(ranked.get(i).title());
        }
        sb.append("\n\nGive ").append(count)
                .append(" short, interesting food facts related to these recipes or their main ingredients.")
                .append(" One fact per line, no numbering, no introduction.\n");
        return sb.toString();
    }

    private static void appendPreferences(StringBuilder sb, Preferences p) {
        if (!p.diets().isEmpty()) {
            sb.append("Dietary preferences: ").append(String.join(", ", p.diets().stream().sorted().toList()))
                    .append('\n');
        }
        if (p.skillLevel() != null && !p.skillLevel().isBlank()) {
            sb.append("Cooking skill: ").append(p.skillLevel()).append('\n');
        }
        if (p.servings() != null) {
            sb.append("Servings: ").append(p.servings()).append('\n');
        }
        if (p.goal() != null && !p.goal().isBlank()) {
            sb.append("Goal: ").append(p.goal()).append('\n');
        }
    }

    private static void appendRecipes(StringBuilder sb, List<Candidate> ranked) {
        int n = Math.min(MAX_RECIPES, ranked.size());
        for (int i = 0; i < n; i++) {
            Candidate c = ranked.get(i);
            sb.append(i + 1).append(". ").append(c.title()).append('\n');
            if (!c.fromDatabase()) {
                sb.append("   Source URL: ").append(c.sourceId()).append('\n');
            }
            appendFacts(sb, c.facts());
            if (!c.ingredients().isEmpty()) {
                sb.append("   Ingredients:\n");
                c.ingredients().stream().limit(MAX_INGREDIENTS)
                        .forEach(line -> sb.append("   - ").append(line).append('\n'));
            }
            if (!c.instructions().isEmpty()) {
                sb.append("   Steps:\n");
                List<String> steps = c.instructions();
                for (int s = 0; s < Math.min(MAX_STEPS, steps.size()); s++) {
                    sb.append("   ").append(s + 1).append(". ").append(steps.get(s)).append('\n');
                }
            }
            sb.append('\n');
        }
    }

    private static void appendFacts(StringBuilder sb, RecipeFacts f) {
        if (f.totalTime() != null) {
            sb.append("   Total time: ").append(f.totalTime()).append('\n');
        } else if (f.cookTime() != null) {
            sb.append("   Cook time: ").append(f.cookTime()).append('\n');
        }
        if (f.servings() != null) {
            sb.append("   Serves: ").append(f.servings()).append('\n');
        }
    }
}
