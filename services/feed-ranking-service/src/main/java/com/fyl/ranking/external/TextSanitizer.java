package com.fyl.ranking.external;

import java.util.regex.Pattern;

public final class TextSanitizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String ELLIPSIS = "...";

    private TextSanitizer() {
    }

    /**
     * Collapses whitespace runs to single spaces and caps the result at {@code maxLength}
     * characters, ending truncated text with an ellipsis.
     */
    public static String sanitize(String raw, int maxLength) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String text = WHITESPACE.matcher(raw.trim()).replaceAll(" ");
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return text.substring(0, Math.max(maxLength, 0));
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }
}
