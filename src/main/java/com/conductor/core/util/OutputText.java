package com.conductor.core.util;

/**
 * Text helpers for agent output shown to chat users.
 */
public final class OutputText {

    private OutputText() {}

    /**
     * Truncates text to roughly {@code maxChars}, keeping the head and tail for context.
     */
    public static String truncate(String text, int maxChars) {
        if (text == null || maxChars <= 0 || text.length() <= maxChars) return text;
        int headSize = maxChars / 2;
        int tailSize = maxChars - headSize;
        return text.substring(0, headSize)
                + "\n\n... [truncated " + (text.length() - maxChars) + " chars] ...\n\n"
                + text.substring(text.length() - tailSize);
    }

    /**
     * Cuts a single-line preview, appending "..." when shortened.
     */
    public static String preview(String text, int maxChars) {
        if (text == null) return "";
        String flat = text.replace('\n', ' ').strip();
        if (flat.length() <= maxChars) return flat;
        return flat.substring(0, maxChars) + "...";
    }
}
