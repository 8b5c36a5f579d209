package com.netcourier.docstruct.service.dedup;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.,;:!?]+$");

    private TextNormalizer() {
    }

    /**
     * Lowercases, trims, collapses internal whitespace and strips trailing punctuation.
     */
    public static String normalizeKey(String key) {
        if (key == null) {
            return "";
        }
        String collapsed = collapseWhitespace(key).toLowerCase(Locale.ROOT);
        return TRAILING_PUNCTUATION.matcher(collapsed).replaceAll("");
    }

    /**
     * Comparison form of a value: recognised dates compare by calendar date, anything else by its
     * normalized text.
     */
    public static String comparisonValue(String value) {
        return DateValues.parse(value)
                .map(date -> "date:" + date)
                .orElseGet(() -> "text:" + normalizeKey(value));
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }
}
