package com.williamcallahan.literature_search_engine.util;

/**
 * Lightweight helpers for row-count clamping so controllers and the aggregator
 * share the same semantics without re-implementing them.
 */
public final class PagingUtils {

    private PagingUtils() {
        // Utility class
    }

    /**
     * Clamp {@code value} to the inclusive {@code [min, max]} range.
     */
    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Clamp a row-count request, honouring the default when {@code requested <= 0}.
     */
    public static int safeLimit(int requested, int defaultValue, int min, int max) {
        int base = requested > 0 ? requested : defaultValue;
        return clamp(base, min, max);
    }
}
