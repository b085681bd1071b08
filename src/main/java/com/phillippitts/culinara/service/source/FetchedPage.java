package com.phillippitts.culinara.service.source;

import com.phillippitts.culinara.domain.RecipeFacts;

import java.util.List;

/**
 * Parsed content of a fetched page.
 *
 * <p>A page is either a single recipe (title, ingredients, instructions, facts) or a collection
 * page that links to several recipes ({@code collection == true}, {@code links} populated).
 *
 * @param url          final page URL
 * @param title        page or recipe title
 * @param ingredients  ingredient lines
 * @param instructions instruction steps
 * @param facts        structured facts, or null
 * @param collection   true when the fetcher recognised a recipe listing
 * @param links        recipe links found on the page
 */
public record FetchedPage(
        String url,
        String title,
        List<String> ingredients,
        List<String> instructions,
        RecipeFacts facts,
        boolean collection,
        List<String> links
) {

    public FetchedPage {
        title = title == null ? "" : title;
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static FetchedPage recipe(String url, String title, List<String> ingredients,
                                     List<String> instructions, RecipeFacts facts) {
        return new FetchedPage(url, title, ingredients, instructions, facts, false, List.of());
    }

    public static FetchedPage collection(String url, String title, List<String> links) {
        return new FetchedPage(url, title, List.of(), List.of(), null, true, links);
    }

    /**
     * Returns true when the page carries nothing usable as a recipe.
     */
    public boolean isBlank() {
        return title.isBlank() && ingredients.isEmpty() && instructions.isEmpty();
    }

    /**
     * Returns true when the page has ingredients or instructions of its own.
     */
    public boolean hasRecipeContent() {
        return !ingredients.isEmpty() || !instructions.isEmpty();
    }
}
