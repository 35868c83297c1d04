package com.phillippitts.multishot.util;

/** Utility for privacy-safe logging of prompt and response previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: whitespace runs collapsed, cut at max characters with "..." appended
     * when something was dropped.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        String flat = s.strip().replaceAll("\\s+", " ");
        return flat.length() <= max ? flat : truncate(flat, max) + "...";
    }
}
