package com.phillippitts.culinara.service.scrape;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognises pages that list several recipes ("25 Easy Weeknight Dinners",
 * {@code /collections/pasta}) rather than describing one.
 *
 * <p>Used when the fetcher does not flag collection pages itself. Stateless.
 */
public final class CollectionPageDetector {

    private static final List<String> URL_MARKERS = List.of(
            "/collection/", "/collections/", "/roundup/", "/roundups/", "/ideas/", "/browse/",
            "/gallery/");

    private static final List<String> TITLE_KEYWORDS = List.of(
            "collection", "roundup", "easy recipes", "quick recipes", "dinner recipes",
            "lunch recipes", "breakfast recipes", "vegetarian recipes", "vegan recipes",
            "batch cooking recipes", "recipe ideas");

    private static final Pattern NUMBERED_LIST = Pattern.compile(
            "\\b\\d+\\s+(?:\\w+\\s+){0,3}(?:recipes|dishes|meals|snacks|dinners|ideas)\\b");

    private static final Pattern RANKED_LIST = Pattern.compile("^(?:the\\s+)?(?:best|top)\\s+\\d+\\b");

    /**
     * Returns true when the URL or title looks like a recipe listing.
     *
     * @param url   page URL (may be null)
     * @param title page title (may be null)
     */
    public boolean isCollection(String url, String title) {
        String urlLower = url == null ? "" : url.toLowerCase(Locale.ROOT);
        for (String marker : URL_MARKERS) {
            if (urlLower.contains(marker)) {
                return true;
            }
        }
        if (title == null || title.isBlank()) {
            return false;
        }
        String t = title.toLowerCase(Locale.ROOT).trim();
        if (t.endsWith(" recipes") || t.endsWith(" dishes")) {
            return true;
        }
        for (String keyword : TITLE_KEYWORDS) {
            if (t.contains(keyword)) {
                return true;
            }
        }
        return NUMBERED_LIST.matcher(t).find() || RANKED_LIST.matcher(t).find();
    }
}
