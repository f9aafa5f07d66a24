/**
 * Semantic Scholar Graph API adapter
 *
 * @author William Callahan
 *
 * Features:
 * - Title search through paper/search
 * - DOI lookup through the DOI: paper id prefix
 * - API key sent as x-api-key, which also permits a shorter request spacing
 */
package com.williamcallahan.literature_search_engine.service.source;

import com.fasterxml.jackson.databind.JsonNode;
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

public class SemanticScholarSource implements LiteratureSource {

    public static final String NAME = "semanticscholar";
    public static final String BASE_URL = "https://api.semanticscholar.org/graph/v1";
    public static final String API_KEY_HEADER = "x-api-key";
    public static final Duration TIMEOUT = Duration.ofSeconds(16);

    static final String FIELDS = "title,year,authors,url,citationCount,externalIds";

    private final SourceHttpClient http;

    public SemanticScholarSource(SourceHttpClient http) {
        this.http = http;
    }

    /**
     * Keyed clients may call five times a second; anonymous ones once.
     */
    public static Duration minInterval(boolean hasApiKey) {
        return hasApiKey ? Duration.ofMillis(200) : Duration.ofSeconds(1);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<List<Paper>> searchByTitle(String title, int limit) {
        if (!ValidationUtils.hasText(title) || limit <= 0) {
            return Mono.just(List.of());
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", title.trim());
        params.put("limit", limit);
        params.put("fields", FIELDS);
        return http.getJson("/paper/search", params)
            .map(node -> PaperJsonUtils.mapItems(node.get("data"), SemanticScholarSource::toPaper, limit, NAME));
    }

    @Override
    public Mono<Paper> lookupByDoi(String doi) {
        String cleaned = DoiUtils.clean(doi);
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        return http.getJson("/paper/DOI:" + UriUtils.encodePath(cleaned, StandardCharsets.UTF_8), Map.of("fields", FIELDS), true)
            .filter(node -> node.isObject() && PaperJsonUtils.text(node, "title") != null)
            .map(SemanticScholarSource::toPaper);
    }

    static Paper toPaper(JsonNode paper) {
        String doi = PaperJsonUtils.doi(paper.path("externalIds"), "DOI");
        String url = PaperJsonUtils.text(paper, "url");
        return new Paper(
            PaperJsonUtils.text(paper, "title"),
            PaperJsonUtils.integer(paper, "year"),
            doi,
            url != null ? url : DoiUtils.toDoiUrl(doi),
            PaperJsonUtils.authorsFromArray(paper.get("authors"), author -> PaperJsonUtils.text(author, "name")),
            NAME,
            PaperJsonUtils.integer(paper, "citationCount")
        );
    }
}
