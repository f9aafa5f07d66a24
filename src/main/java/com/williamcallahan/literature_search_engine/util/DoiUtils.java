package com.williamcallahan.literature_search_engine.util;

import java.util.regex.Pattern;

/**
 * Detection and normalization of DOIs.
 *
 * <p>{@link #normalize(String)} only removes labels and resolver prefixes. Anything that ends up
 * on the wire or in a deduplication key goes through {@link #clean(String)}, which additionally
 * drops sentence punctuation that tends to stick to DOIs pasted from prose.</p>
 */
public final class DoiUtils {

    public static final String DOI_RESOLVER = "https://doi.org/";

    private static final Pattern DOI_LABEL = Pattern.compile("^\\s*doi\\s*:\\s*", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern RESOLVER_PREFIX = Pattern.compile("^https?://(dx\\.)?doi\\.org/", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[).,;]+$");
    private static final Pattern DOI_PATTERN = Pattern.compile("10\\.[0-9]{4,9}/\\S+", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);

    private DoiUtils() {
    }

    /**
     * Strips a leading {@code doi:} label and a leading {@code http(s)://[dx.]doi.org/} prefix.
     * Case and trailing punctuation are left untouched.
     *
     * @param raw user or source supplied value, may be null
     * @return normalized value, never null
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String value = ValidationUtils.stripWhitespace(raw);
        String previous;
        // repeat until stable so stacked prefixes ("doi: https://doi.org/...") collapse in one call
        do {
            previous = value;
            value = DOI_LABEL.matcher(value).replaceFirst("");
            value = ValidationUtils.stripWhitespace(RESOLVER_PREFIX.matcher(value).replaceFirst(""));
        } while (!value.equals(previous));
        return value;
    }

    public static String stripTrailingPunctuation(String value) {
        if (value == null) {
            return "";
        }
        return TRAILING_PUNCTUATION.matcher(value).replaceFirst("");
    }

    /**
     * {@link #normalize(String)} followed by {@link #stripTrailingPunctuation(String)}.
     */
    public static String clean(String raw) {
        return stripTrailingPunctuation(normalize(raw));
    }

    public static boolean looksLikeDoi(String raw) {
        return matchesDoiPattern(clean(raw));
    }

    /**
     * Whole-string match against {@code 10.NNNN/suffix} without any normalization.
     */
    public static boolean matchesDoiPattern(String value) {
        return value != null && DOI_PATTERN.matcher(value).matches();
    }

    public static String toDoiUrl(String doi) {
        return ValidationUtils.hasText(doi) ? DOI_RESOLVER + doi : null;
    }
}
