package com.phillippitts.callagent.util;

/** Utility for privacy-safe logging of caller speech and phone numbers. */
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
     * Masks all but the last {@code visible} digits of a phone number; returns "" for null.
     */
    public static String maskNumber(String number, int visible) {
        if (number == null || number.isBlank()) {
            return "";
        }
        String trimmed = number.trim();
        int keep = Math.max(0, Math.min(visible, trimmed.length()));
        int hidden = trimmed.length() - keep;
        return "*".repeat(hidden) + trimmed.substring(hidden);
    }
}
