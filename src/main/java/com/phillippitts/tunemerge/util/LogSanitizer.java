package com.phillippitts.tunemerge.util;

import java.util.regex.Pattern;

/** Utility for privacy-safe logging of user queries. */
public final class LogSanitizer {

    /** Longest query preview written to logs. */
    public static final int QUERY_PREVIEW_MAX = 64;

    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n\\t]+");

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of a search query, truncated to {@link #QUERY_PREVIEW_MAX} characters
     * with a trailing ellipsis when cut. Line breaks become spaces.
     */
    public static String queryPreview(String query) {
        if (query == null) {
            return "";
        }
        String flat = LINE_BREAKS.matcher(query).replaceAll(" ");
        return flat.length() <= QUERY_PREVIEW_MAX ? flat : truncate(flat, QUERY_PREVIEW_MAX) + "...";
    }
}
