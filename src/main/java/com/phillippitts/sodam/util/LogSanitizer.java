package com.phillippitts.sodam.util;

/** Utility for privacy-safe logging of transcript text and payload previews. */
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
     * Masks a bearer token for logs, keeping only the last four characters.
     */
    public static String maskToken(String token) {
        if (token == null || token.isBlank()) {
            return "<none>";
        }
        if (token.length() <= 4) {
            return "****";
        }
        return "****" + token.substring(token.length() - 4);
    }
}
