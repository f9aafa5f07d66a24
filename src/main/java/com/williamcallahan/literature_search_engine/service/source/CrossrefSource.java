/**
 * Crossref REST API adapter
 *
 * @author William Callahan
 *
 * Features:
 * - Title and author search restricted to journal articles
 * - DOI lookup through the works route, 404 meaning no such DOI
 * - Year taken from the first populated issued/published/created date
 * - Sends the polite-pool mailto parameter when configured
 */
package com.williamcallahan.literature_search_engine.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.literature_search_engine.exception.SourceException;
import com.williamcallahan.literature_search_engine.model.Paper;
import com.williamcallahan.literature_search_engine.util.DoiUtils;
import com.williamcallahan.literature_search_engine.util.PaperJsonUtils;
import com.williamcallahan.literature_search_engine.util.ValidationUtils;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class CrossrefSource implements LiteratureSource {

    public static final String NAME = "crossref";
    public static final String BASE_URL = "https://api.crossref.org";
    public static final Duration TIMEOUT = Duration.ofSeconds(12);
    public static final Duration MIN_INTERVAL = Duration.ofMillis(50);

    static final String FILTER = "type:journal-article";
    static final String SELECT = "DOI,title,URL,author,issued,published-online,published-print,created,is-referenced-by-count";
    private static final List<String> YEAR_FIELDS = List.of("issued", "published-online", "published-print", "created");

    private final SourceHttpClient http;

    public CrossrefSource(SourceHttpClient http) {
        this.http = http;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<List<Paper>> searchByTitle(String title, int limit) {
        return searchWorks("query", title, limit);
    }

    /**
     * Journal articles whose author list matches {@code author}.
     */
    public Mono<List<Paper>> searchByAuthor(String author, int limit) {
        return searchWorks("query.author", author, limit);
    }

    @Override
    public Mono<Paper> lookupByDoi(String doi) {
        String cleaned = DoiUtils.clean(doi);
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        return http.getJson("/works/" + UriUtils.encodePath(cleaned, StandardCharsets.UTF_8), Map.of(), true)
            .flatMap(node -> {
                JsonNode message = node.get("message");
                if (message == null || !message.isObject()) {
                    return Mono.error(new SourceException(NAME, SourceException.UNPARSEABLE));
                }
                return Mono.just(toPaper(message));
            });
    }

    private Mono<List<Paper>> searchWorks(String queryParam, String value, int limit) {
        if (!ValidationUtils.hasText(value) || limit <= 0) {
            return Mono.just(List.of());
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(queryParam, value.trim());
        params.put("rows", limit);
        params.put("filter", FILTER);
        params.put("select", SELECT);
        return http.getJson("/works", params)
            .map(node -> PaperJsonUtils.mapItems(node.path("message").get("items"), CrossrefSource::toPaper, limit, NAME));
    }

    static Paper toPaper(JsonNode item) {
        String doi = PaperJsonUtils.doi(item, "DOI");
        String url = PaperJsonUtils.text(item, "URL");
        return new Paper(
            PaperJsonUtils.firstText(item, "title"),
            year(item),
            doi,
            url != null ? url : DoiUtils.toDoiUrl(doi),
            PaperJsonUtils.authorsFromArray(item.get("author"), CrossrefSource::authorName),
            NAME,
            PaperJsonUtils.integer(item, "is-referenced-by-count")
        );
    }

    private static Integer year(JsonNode item) {
        for (String field : YEAR_FIELDS) {
            JsonNode parts = item.path(field).path("date-parts");
            if (parts.isArray() && !parts.isEmpty()) {
                JsonNode first = parts.get(0);
                if (first.isArray() && !first.isEmpty() && first.get(0).isIntegralNumber()) {
                    return first.get(0).intValue();
                }
            }
        }
        return null;
    }

    private static String authorName(JsonNode author) {
        if (author == null || !author.isObject()) {
            return null;
        }
        return Stream.of(PaperJsonUtils.text(author, "given"), PaperJsonUtils.text(author, "family"))
            .filter(ValidationUtils::hasText)
            .collect(Collectors.joining(" "));
    }
}
