package com.phillippitts.structurecoach.util;

/** Utility for privacy-safe logging of answer text. */
public final class LogSanitizer {

    /** Default number of characters of answer text allowed into logs. */
    public static final int PREVIEW_CHARS = 40;

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
     * Single-line preview of answer text: newlines collapsed, truncated, with an ellipsis
     * and the full length when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        if (flat.length() <= PREVIEW_CHARS) {
            return flat;
        }
        return truncate(flat, PREVIEW_CHARS) + "...(" + flat.length() + " chars)";
    }
}
