/**
 * Canonical bibliographic record every literature source is mapped into
 *
 * @author William Callahan
 *
 * Features:
 * - Immutable value object shared by all sources and the aggregator
 * - Falls back to a placeholder title when a source omits it
 * - Derives the cross-source deduplication key from DOI or title
 */
package com.williamcallahan.literature_search_engine.model;

import com.williamcallahan.literature_search_engine.util.ValidationUtils;

import java.util.Locale;
import java.util.regex.Pattern;

public record Paper(
    String title,
    Integer year,
    String doi,
    String url,
    String authors,
    String source,
    Integer citedBy
) {

    public static final String UNTITLED = "(untitled)";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final int TITLE_KEY_LENGTH = 200;

    public Paper {
        title = ValidationUtils.hasText(title) ? ValidationUtils.stripWhitespace(title) : UNTITLED;
        doi = ValidationUtils.hasText(doi) ? ValidationUtils.stripWhitespace(doi) : null;
        url = ValidationUtils.hasText(url) ? ValidationUtils.stripWhitespace(url) : null;
        authors = ValidationUtils.stripWhitespace(authors);
        source = ValidationUtils.stripWhitespace(source);
    }

    public boolean hasDoi() {
        return doi != null;
    }

    /**
     * Deduplication key: the lower-cased DOI when known, otherwise the first 200
     * characters of the whitespace-collapsed, lower-cased title.
     */
    public String key() {
        if (hasDoi()) {
            return "doi:" + doi.toLowerCase(Locale.ROOT);
        }
        String collapsed = WHITESPACE.matcher(title.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return "title:" + (collapsed.length() > TITLE_KEY_LENGTH ? collapsed.substring(0, TITLE_KEY_LENGTH) : collapsed);
    }

    public Paper withDoi(String newDoi) {
        return new Paper(title, year, newDoi, url, authors, source, citedBy);
    }
}
