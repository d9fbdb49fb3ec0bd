package com.phillippitts.enginecoordinator.util;

/** Utility for privacy-safe logging of prompt and payload previews. */
public final class LogSanitizer {

    private static final int DEFAULT_PREVIEW = 80;

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
     * Single-line preview of a prompt: whitespace collapsed, truncated, with an ellipsis when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= DEFAULT_PREVIEW ? flat : truncate(flat, DEFAULT_PREVIEW) + "...";
    }
}
