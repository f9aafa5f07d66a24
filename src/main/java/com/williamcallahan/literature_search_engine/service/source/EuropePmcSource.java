package com.williamcallahan.literature_search_engine.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.literature_search_engine.model.Paper;
import com.williamcallahan.literature_search_engine.util.DoiUtils;
import com.williamcallahan.literature_search_engine.util.PaperJsonUtils;
import com.williamcallahan.literature_search_engine.util.ValidationUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Europe PMC REST search adapter. Both operations go through the same search route,
 * with a {@code TITLE:"..."} or {@code DOI:...} query.
 */
public class EuropePmcSource implements LiteratureSource {

    public static final String NAME = "europepmc";
    public static final String BASE_URL = "https://www.ebi.ac.uk/europepmc/webservices/rest";
    public static final Duration TIMEOUT = Duration.ofSeconds(14);
    public static final Duration MIN_INTERVAL = Duration.ofMillis(120);

    private static final String ARTICLE_URL = "https://europepmc.org/article/";

    private final SourceHttpClient http;

    public EuropePmcSource(SourceHttpClient http) {
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
        return search("TITLE:\"" + title.trim() + "\"", limit);
    }

    @Override
    public Mono<Paper> lookupByDoi(String doi) {
        String cleaned = DoiUtils.clean(doi);
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        return search("DOI:" + cleaned, 1)
            .flatMap(papers -> papers.isEmpty() ? Mono.empty() : Mono.just(papers.get(0)));
    }

    private Mono<List<Paper>> search(String query, int pageSize) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("format", "json");
        params.put("pageSize", pageSize);
        return http.getJson("/search", params)
            .map(node -> PaperJsonUtils.mapItems(node.path("resultList").get("result"), EuropePmcSource::toPaper, pageSize, NAME));
    }

    static Paper toPaper(JsonNode result) {
        String doi = PaperJsonUtils.doi(result, "doi");
        return new Paper(
            PaperJsonUtils.text(result, "title"),
            PaperJsonUtils.lenientInteger(result, "pubYear"),
            doi,
            doi != null ? DoiUtils.toDoiUrl(doi) : articleUrl(result),
            PaperJsonUtils.text(result, "authorString"),
            NAME,
            null
        );
    }

    // source is the Europe PMC collection (MED, PMC, PPR...), id its identifier there
    private static String articleUrl(JsonNode result) {
        String collection = PaperJsonUtils.text(result, "source");
        String id = PaperJsonUtils.text(result, "id");
        if (collection == null || id == null) {
            return null;
        }
        return ARTICLE_URL + collection + "/" + id;
    }
}
