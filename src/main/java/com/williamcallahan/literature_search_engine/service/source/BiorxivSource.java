package com.williamcallahan.literature_search_engine.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.literature_search_engine.model.Paper;
import com.williamcallahan.literature_search_engine.util.DoiUtils;
import com.williamcallahan.literature_search_engine.util.PaperJsonUtils;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * bioRxiv / medRxiv details API. One class serves both servers; the server name doubles as the
 * source tag. The API has no title search, so only DOI lookups reach the network.
 */
public class BiorxivSource implements LiteratureSource {

    public static final String BIORXIV = "biorxiv";
    public static final String MEDRXIV = "medrxiv";
    public static final String BASE_URL = "https://api.biorxiv.org";
    public static final Duration TIMEOUT = Duration.ofSeconds(18);
    public static final Duration MIN_INTERVAL = Duration.ofMillis(200);

    private final SourceHttpClient http;
    private final String server;

    public BiorxivSource(SourceHttpClient http, String server) {
        if (!BIORXIV.equals(server) && !MEDRXIV.equals(server)) {
            throw new IllegalArgumentException("Unsupported preprint server: " + server);
        }
        this.http = http;
        this.server = server;
    }

    @Override
    public String name() {
        return server;
    }

    @Override
    public Mono<List<Paper>> searchByTitle(String title, int limit) {
        return Mono.just(List.of());
    }

    @Override
    public Mono<Paper> lookupByDoi(String doi) {
        String cleaned = DoiUtils.clean(doi);
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        String path = "/details/" + server + "/" + UriUtils.encodePath(cleaned, StandardCharsets.UTF_8) + "/na/json";
        return http.getJson(path, Map.of(), true)
            .flatMap(node -> {
                JsonNode collection = node.get("collection");
                List<Paper> papers = PaperJsonUtils.mapItems(collection, this::toPaper, 1, server);
                return papers.isEmpty() ? Mono.empty() : Mono.just(papers.get(0));
            });
    }

    Paper toPaper(JsonNode preprint) {
        String doi = PaperJsonUtils.doi(preprint, "doi");
        return new Paper(
            PaperJsonUtils.text(preprint, "title"),
            PaperJsonUtils.leadingYear(PaperJsonUtils.text(preprint, "date")),
            doi,
            DoiUtils.toDoiUrl(doi),
            PaperJsonUtils.text(preprint, "authors"),
            server,
            null
        );
    }
}
