package com.phillippitts.culinara.util;

/** Utility for privacy-safe logging of query text and page URLs. */
public final class LogSanitizer {

    /** Default preview length for query text in log lines. */
    public static final int QUERY_PREVIEW = 80;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     * Line breaks are flattened so a query cannot forge extra log lines.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }

    /** Truncate query text to {@link #QUERY_PREVIEW} characters. */
    public static String query(String text) {
        return truncate(text, QUERY_PREVIEW);
    }
}
