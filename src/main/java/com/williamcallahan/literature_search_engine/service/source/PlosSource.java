package com.williamcallahan.literature_search_engine.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.literature_search_engine.model.Paper;
import com.williamcallahan.literature_search_engine.util.DoiUtils;
import com.williamcallahan.literature_search_engine.util.PaperJsonUtils;
import com.williamcallahan.literature_search_engine.util.ValidationUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PLOS Solr search adapter.
 *
 * <p>PLOS document ids are usually DOIs. An id (or {@code doi} field) is only used as the DOI when
 * the whole value has DOI shape.</p>
 */
public class PlosSource implements LiteratureSource {

    public static final String NAME = "plos";
    public static final String BASE_URL = "http://api.plos.org/search";
    public static final Duration TIMEOUT = Duration.ofSeconds(16);
    public static final Duration MIN_INTERVAL = Duration.ofMillis(200);

    private final SourceHttpClient http;

    public PlosSource(SourceHttpClient http) {
        this.http = http;
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
        return query("title:\"" + title.trim() + "\"", limit)
            .map(docs -> PaperJsonUtils.mapItems(docs, doc -> toPaper(doc, null), limit, NAME));
    }

    @Override
    public Mono<Paper> lookupByDoi(String doi) {
        String cleaned = DoiUtils.clean(doi);
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        return query("doi:\"" + cleaned + "\"", 1)
            .map(docs -> PaperJsonUtils.mapItems(docs, doc -> toPaper(doc, cleaned), 1, NAME))
            .flatMap(papers -> papers.isEmpty() ? Mono.empty() : Mono.just(papers.get(0)));
    }

    private Mono<JsonNode> query(String q, int rows) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", q);
        params.put("wt", "json");
        params.put("rows", rows);
        return http.getJson("", params)
            .map(node -> node.path("response").path("docs"));
    }

    /**
     * @param fallbackDoi DOI to use when the document carries none, e.g. the one just looked up
     */
    static Paper toPaper(JsonNode doc, String fallbackDoi) {
        String doi = documentDoi(doc);
        if (doi == null) {
            doi = fallbackDoi;
        }
        return new Paper(
            PaperJsonUtils.text(doc, "title_display"),
            PaperJsonUtils.leadingYear(PaperJsonUtils.text(doc, "publication_date")),
            doi,
            DoiUtils.toDoiUrl(doi),
            authors(doc.get("author_display")),
            NAME,
            null
        );
    }

    private static String documentDoi(JsonNode doc) {
        for (String field : List.of("id", "doi")) {
            String raw = PaperJsonUtils.text(doc, field);
            if (raw != null && DoiUtils.matchesDoiPattern(raw)) {
                return DoiUtils.clean(raw);
            }
        }
        return null;
    }

    private static String authors(JsonNode names) {
        if (names == null || !names.isArray() || names.isEmpty()) {
            return "";
        }
        List<String> values = new ArrayList<>();
        for (int i = 0; i < names.size() && i < PaperJsonUtils.MAX_LISTED_AUTHORS; i++) {
            JsonNode name = names.get(i);
            values.add(PaperJsonUtils.text(name));
        }
        return PaperJsonUtils.joinAuthors(values, names.size());
    }
}
