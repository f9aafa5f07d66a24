/**
 * Tolerant JSON accessors shared by the literature source mappers
 *
 * @author William Callahan
 *
 * Features:
 * - Treats missing, null or mistyped fields as absent instead of failing
 * - Builds the capped author summary used by every source
 * - Maps result arrays item by item, skipping malformed entries
 */
package com.williamcallahan.literature_search_engine.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.literature_search_engine.model.Paper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public final class PaperJsonUtils {

    private static final Logger logger = LoggerFactory.getLogger(PaperJsonUtils.class);

    public static final int MAX_LISTED_AUTHORS = 4;
    public static final String ET_AL = " et al.";

    private PaperJsonUtils() {
    }

    /**
     * Trimmed string value of {@code node.field}, or null when missing, blank or not a string.
     */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        return text(node.get(field));
    }

    public static String text(JsonNode value) {
        if (value == null || !value.isTextual()) {
            return null;
        }
        String trimmed = value.asText().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * First element of a string array field, or null.
     */
    public static String firstText(JsonNode node, String field) {
        JsonNode array = node == null ? null : node.get(field);
        if (array == null || !array.isArray() || array.isEmpty()) {
            return null;
        }
        return text(array.get(0));
    }

    /**
     * Integral number value only; strings and floats count as absent.
     */
    public static Integer integer(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            return null;
        }
        return value.intValue();
    }

    /**
     * Integral number, or a string holding one (some sources send years as strings).
     */
    public static Integer lenientInteger(JsonNode node, String field) {
        Integer strict = integer(node, field);
        if (strict != null) {
            return strict;
        }
        String raw = text(node, field);
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Year from the first four characters of a date string such as {@code 2021-03-04}.
     */
    public static Integer leadingYear(String date) {
        if (date == null) {
            return null;
        }
        String trimmed = date.trim();
        if (trimmed.length() < 4) {
            return null;
        }
        for (int i = 0; i < 4; i++) {
            if (!Character.isDigit(trimmed.charAt(i))) {
                return null;
            }
        }
        return Integer.parseInt(trimmed.substring(0, 4));
    }

    /**
     * Joins the first {@value #MAX_LISTED_AUTHORS} non-blank names and appends {@value #ET_AL}
     * when the source listed more authors than that.
     *
     * @param names names in source order, blanks allowed
     * @param listedCount how many author entries the source returned in total
     */
    public static String joinAuthors(List<String> names, int listedCount) {
        List<String> kept = new ArrayList<>();
        for (int i = 0; i < names.size() && i < MAX_LISTED_AUTHORS; i++) {
            String name = names.get(i);
            if (ValidationUtils.hasText(name)) {
                kept.add(name.trim());
            }
        }
        String joined = String.join(", ", kept);
        return listedCount > MAX_LISTED_AUTHORS ? joined + ET_AL : joined;
    }

    /**
     * Author summary from an array, reading each element with {@code nameOf}. Elements of the wrong
     * shape yield null names and are dropped.
     */
    public static String authorsFromArray(JsonNode array, Function<JsonNode, String> nameOf) {
        if (array == null || !array.isArray() || array.isEmpty()) {
            return "";
        }
        List<String> names = new ArrayList<>();
        for (int i = 0; i < array.size() && i < MAX_LISTED_AUTHORS; i++) {
            names.add(nameOf.apply(array.get(i)));
        }
        return joinAuthors(names, array.size());
    }

    /**
     * DOI read from a source field, cleaned the same way lookups are.
     */
    public static String doi(JsonNode node, String field) {
        String raw = text(node, field);
        if (raw == null) {
            return null;
        }
        String cleaned = DoiUtils.clean(raw);
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Maps the object items of {@code array} in order, stopping at {@code limit}. Non-object items
     * and items whose mapping throws are skipped.
     */
    public static List<Paper> mapItems(JsonNode array, Function<JsonNode, Paper> mapper, int limit, String source) {
        List<Paper> papers = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return papers;
        }
        for (JsonNode item : array) {
            if (papers.size() >= limit) {
                break;
            }
            if (item == null || !item.isObject()) {
                logger.debug("Skipping non-object result item from {}", source);
                continue;
            }
            try {
                Paper paper = mapper.apply(item);
                if (paper != null) {
                    papers.add(paper);
                }
            } catch (RuntimeException e) {
                logger.debug("Skipping malformed result item from {}: {}", source, e.getMessage());
            }
        }
        return papers;
    }
}
