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
 * OSF preprints adapter, scoped to a single preprint provider ({@code psyarxiv} unless configured).
 * OSF lists contributors through a separate relationship, so authors are left empty.
 */
public class OsfPreprintsSource implements LiteratureSource {

    public static final String NAME = "osf";
    public static final String BASE_URL = "https://api.osf.io/v2";
    public static final String DEFAULT_PROVIDER = "psyarxiv";
    public static final Duration TIMEOUT = Duration.ofSeconds(18);
    public static final Duration MIN_INTERVAL = Duration.ofMillis(250);

    private static final List<String> DATE_FIELDS = List.of("date_published", "date_created", "date_modified");

    private final SourceHttpClient http;
    private final String provider;

    public OsfPreprintsSource(SourceHttpClient http, String provider) {
        this.http = http;
        this.provider = ValidationUtils.trimToDefault(provider, DEFAULT_PROVIDER);
    }

    @Override
    public String name() {
        return NAME;
    }

    public String getProvider() {
        return provider;
    }

    @Override
    public Mono<List<Paper>> searchByTitle(String title, int limit) {
        if (!ValidationUtils.hasText(title) || limit <= 0) {
            return Mono.just(List.of());
        }
        return preprints("filter[title]", title.trim(), limit);
    }

    @Override
    public Mono<Paper> lookupByDoi(String doi) {
        String cleaned = DoiUtils.clean(doi);
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        return preprints("filter[doi]", cleaned, 1)
            .flatMap(papers -> papers.isEmpty() ? Mono.empty() : Mono.just(papers.get(0)));
    }

    private Mono<List<Paper>> preprints(String filter, String value, int pageSize) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("filter[provider]", provider);
        params.put(filter, value);
        params.put("page[size]", pageSize);
        return http.getJson("/preprints/", params)
            .map(node -> PaperJsonUtils.mapItems(node.get("data"), OsfPreprintsSource::toPaper, pageSize, NAME));
    }

    static Paper toPaper(JsonNode preprint) {
        JsonNode attributes = preprint.path("attributes");
        String doi = PaperJsonUtils.doi(attributes, "doi");
        String url = PaperJsonUtils.text(preprint.path("links"), "html");
        return new Paper(
            PaperJsonUtils.text(attributes, "title"),
            year(attributes),
            doi,
            url != null ? url : DoiUtils.toDoiUrl(doi),
            "",
            NAME,
            null
        );
    }

    private static Integer year(JsonNode attributes) {
        for (String field : DATE_FIELDS) {
            Integer year = PaperJsonUtils.leadingYear(PaperJsonUtils.text(attributes, field));
            if (year != null) {
                return year;
            }
        }
        return null;
    }
}
