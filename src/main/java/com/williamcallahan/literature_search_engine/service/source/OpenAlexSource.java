/**
 * OpenAlex works API adapter
 *
 * @author William Callahan
 *
 * Features:
 * - Title search via the works search parameter
 * - DOI lookup by the doi.org URL used as an external id
 * - Landing page URL preferred over the DOI resolver
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

public class OpenAlexSource implements LiteratureSource {

    public static final String NAME = "openalex";
    public static final String BASE_URL = "https://api.openalex.org";
    public static final Duration TIMEOUT = Duration.ofSeconds(14);
    public static final Duration MIN_INTERVAL = Duration.ofMillis(50);

    static final String SELECT = "id,title,doi,publication_year,authorships,primary_location,cited_by_count";

    private final SourceHttpClient http;

    public OpenAlexSource(SourceHttpClient http) {
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
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("search", title.trim());
        params.put("per-page", limit);
        params.put("select", SELECT);
        return http.getJson("/works", params)
            .map(node -> PaperJsonUtils.mapItems(node.get("results"), OpenAlexSource::toPaper, limit, NAME));
    }

    @Override
    public Mono<Paper> lookupByDoi(String doi) {
        String cleaned = DoiUtils.clean(doi);
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        // the whole resolver URL is one path segment, colon included
        String externalId = UriUtils.encodePathSegment(DoiUtils.toDoiUrl(cleaned), StandardCharsets.UTF_8).replace(":", "%3A");
        return http.getJson("/works/" + externalId, Map.of("select", SELECT), true)
            .filter(node -> node.isObject() && PaperJsonUtils.text(node, "id") != null)
            .map(OpenAlexSource::toPaper);
    }

    static Paper toPaper(JsonNode work) {
        String doi = PaperJsonUtils.doi(work, "doi");
        String url = PaperJsonUtils.text(work.path("primary_location"), "landing_page_url");
        return new Paper(
            PaperJsonUtils.text(work, "title"),
            PaperJsonUtils.integer(work, "publication_year"),
            doi,
            url != null ? url : DoiUtils.toDoiUrl(doi),
            PaperJsonUtils.authorsFromArray(work.get("authorships"),
                authorship -> PaperJsonUtils.text(authorship.path("author"), "display_name")),
            NAME,
            PaperJsonUtils.integer(work, "cited_by_count")
        );
    }
}
