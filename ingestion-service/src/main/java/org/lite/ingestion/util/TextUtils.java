package org.lite.ingestion.util;

import java.util.regex.Pattern;

public final class TextUtils {

    private static final Pattern NON_TEXT = Pattern.compile("[^\\w\\s|\\-.,:()]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EMPTY_CELL = Pattern.compile("\\|\\s*\\|");
    private static final Pattern CODE_FENCE_START = Pattern.compile("^```(?:json)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern CODE_FENCE_END = Pattern.compile("\\s*```\\s*$");

    private TextUtils() {
    }

    /**
     * Normalizes recognized text: stray symbols become spaces, whitespace runs collapse to one
     * space and empty table cells merge.
     */
    public static String cleanRecognizedText(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = NON_TEXT.matcher(text).replaceAll(" ");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");
        cleaned = EMPTY_CELL.matcher(cleaned).replaceAll("|");
        return cleaned.trim();
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(text.trim()).length;
    }

    /**
     * Removes a Markdown code fence wrapped around a model response.
     */
    public static String stripCodeFences(String content) {
        if (content == null) {
            return null;
        }
        String stripped = content.trim();
        stripped = CODE_FENCE_START.matcher(stripped).replaceFirst("");
        stripped = CODE_FENCE_END.matcher(stripped).replaceFirst("");
        return stripped.trim();
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
