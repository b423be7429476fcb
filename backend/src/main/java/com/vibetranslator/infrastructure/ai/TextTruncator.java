package com.vibetranslator.infrastructure.ai;

/**
 * Deterministic suffix truncation used to bound prompt payloads.
 */
public final class TextTruncator {

    public static final String ELLIPSIS = "...";

    private TextTruncator() {
    }

    /**
     * Returns the text unchanged when it fits, otherwise its first {@code maxChars - 3}
     * characters followed by {@value #ELLIPSIS}. Not word-aware.
     */
    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxChars) {
            return text;
        }
        int keep = Math.max(0, maxChars - ELLIPSIS.length());
        return text.substring(0, keep) + ELLIPSIS;
    }
}
