package com.phillippitts.podcaster.util;

/** Helpers for keeping page content and model output out of logs and error messages. */
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
     * Truncates and appends an ellipsis marker when text was cut.
     */
    public static String preview(String s, int max) {
        String truncated = truncate(s, max);
        return s != null && s.length() > max ? truncated + "..." : truncated;
    }

    /**
     * Makes an identifier safe for use inside a file name.
     */
    public static String fileSafe(String s) {
        if (s == null || s.isBlank()) {
            return "job";
        }
        return s.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
