package com.williamcallahan.literature_search_engine.util;

import java.util.regex.Pattern;

/**
 * Utility helpers for common null/blank validation checks.
 */
public final class ValidationUtils {
    // Unicode White_Space, U+00A0 included
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private ValidationUtils() {
    }

    public static boolean hasText(String value) {
        return value != null && !stripWhitespace(value).isEmpty();
    }

    /**
     * Removes leading and trailing Unicode whitespace, including U+00A0. Null becomes empty.
     */
    public static String stripWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return EDGE_WHITESPACE.matcher(value).replaceAll("");
    }

    /**
     * Returns {@code value} stripped, or {@code fallback} when it is null or blank.
     */
    public static String trimToDefault(String value, String fallback) {
        return hasText(value) ? stripWhitespace(value) : fallback;
    }

    /**
     * Cuts {@code value} to at most {@code maxLength} characters, tolerating null.
     */
    public static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
}
