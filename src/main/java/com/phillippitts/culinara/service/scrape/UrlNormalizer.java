package com.phillippitts.culinara.service.scrape;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Cleans raw search-result links into fetchable URLs.
 *
 * <ul>
 *   <li>DuckDuckGo redirect links ({@code duckduckgo.com/l/?uddg=...}) are unwrapped.</li>
 *   <li>Scheme-less links ({@code //site/x}, {@code site/x}) get {@code https://}.</li>
 *   <li>Blank entries and duplicates are dropped; first occurrence keeps its position.</li>
 * </ul>
 */
public final class UrlNormalizer {

    private static final String DDG_REDIRECT = "duckduckgo.com/l/?";
    private static final String DDG_TARGET_PARAM = "uddg=";

    private UrlNormalizer() {
    }

    /**
     * Normalizes a list of links.
     *
     * @param rawUrls links as returned by search (may be null)
     * @return distinct normalized URLs in input order
     */
    public static List<String> normalizeAll(List<String> rawUrls) {
        if (rawUrls == null) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String raw : rawUrls) {
            String url = normalize(raw);
            if (!url.isEmpty()) {
                seen.add(url);
            }
        }
        return List.copyOf(new ArrayList<>(seen));
    }

    /**
     * Normalizes one link.
     *
     * @param raw link text, may be null
     * @return normalized URL, or "" when there is nothing usable
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String url = unwrapDuckDuckGo(raw.trim());
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            url = "https://" + stripLeadingSlashes(url);
        }
        return url;
    }

    static String unwrapDuckDuckGo(String url) {
        int redirect = url.indexOf(DDG_REDIRECT);
        if (redirect < 0) {
            return url;
        }
        String query = url.substring(redirect + DDG_REDIRECT.length());
        for (String part : query.split("&")) {
            if (part.startsWith(DDG_TARGET_PARAM)) {
                return URLDecoder.decode(part.substring(DDG_TARGET_PARAM.length()), StandardCharsets.UTF_8);
            }
        }
        return url;
    }

    private static String stripLeadingSlashes(String url) {
        int i = 0;
        while (i < url.length() && url.charAt(i) == '/') {
            i++;
        }
        return url.substring(i);
    }
}
