package com.phillippitts.querybridge.util;

/** Utility for privacy-safe logging of query previews. */
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
     * Single-line preview for DEBUG logs: newlines flattened, then truncated.
     */
    public static String preview(String s, int max) {
        return truncate(s, max).replace('\n', ' ').replace('\r', ' ');
    }
}
