package com.phillippitts.signbridge.util;

/** Privacy-safe rendering of utterance text for logs. Patient speech never goes to INFO in full. */
public final class LogSanitizer {

    private static final int DEFAULT_PREVIEW = 24;

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
     * Short preview suitable for DEBUG logs, with an ellipsis when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= DEFAULT_PREVIEW ? s : truncate(s, DEFAULT_PREVIEW) + "...";
    }

    /**
     * Length-only description for INFO/WARN logs.
     */
    public static String describe(String s) {
        return "chars=" + (s == null ? 0 : s.length());
    }
}
