/**
 * Directory of Open Access Journals search adapter
 *
 * @author William Callahan
 *
 * Features:
 * - Query travels in the path of the articles search route
 * - Fielded query first, free-text query when the fielded one finds nothing
 * - Optional bearer token for keyed access
 */
package com.williamcallahan.literature_search_engine.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.literature_search_engine.model.Paper;
import com.williamcallahan.literature_search_engine.util.DoiUtils;
import com.williamcallahan.literature_search_engine.util.PaperJsonUtils;
import com.williamcallahan.literature_search_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class DoajSource implements LiteratureSource {

    public static final String NAME = "doaj";
    public static final String BASE_URL = "https://doaj.org/api/v2";
    public static final Duration TIMEOUT = Duration.ofSeconds(16);
    public static final Duration MIN_INTERVAL = Duration.ofMillis(250);

    private final SourceHttpClient http;

    public DoajSource(SourceHttpClient http) {
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
        String query = title.trim();
        return searchWithFallback("bibjson.title:\"" + query + "\"", query, limit);
    }

    @Override
    public Mono<Paper> lookupByDoi(String doi) {
        String cleaned = DoiUtils.clean(doi);
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        return searchWithFallback("bibjson.identifier.id:\"" + cleaned + "\"", cleaned, 1)
            .flatMap(papers -> papers.isEmpty() ? Mono.empty() : Mono.just(papers.get(0)));
    }

    private Mono<List<Paper>> searchWithFallback(String fieldedQuery, String plainQuery, int pageSize) {
        return search(fieldedQuery, pageSize)
            .flatMap(papers -> {
                if (!papers.isEmpty()) {
                    return Mono.just(papers);
                }
                log.debug("DOAJ fielded query '{}' found nothing, retrying as free text", fieldedQuery);
                return search(plainQuery, pageSize);
            });
    }

    private Mono<List<Paper>> search(String query, int pageSize) {
        String path = "/search/articles/" + UriUtils.encodePathSegment(query, StandardCharsets.UTF_8);
        return http.getJson(path, Map.of("pageSize", pageSize))
            .map(node -> PaperJsonUtils.mapItems(node.get("results"), DoajSource::toPaper, pageSize, NAME));
    }

    static Paper toPaper(JsonNode article) {
        JsonNode bibjson = article.path("bibjson");
        String doi = doi(bibjson.get("identifier"));
        String link = firstLink(bibjson.get("link"));
        return new Paper(
            PaperJsonUtils.text(bibjson, "title"),
            PaperJsonUtils.lenientInteger(bibjson, "year"),
            doi,
            link != null ? link : DoiUtils.toDoiUrl(doi),
            PaperJsonUtils.authorsFromArray(bibjson.get("author"), DoajSource::authorName),
            NAME,
            null
        );
    }

    private static String authorName(JsonNode author) {
        if (author.isObject()) {
            return PaperJsonUtils.text(author, "name");
        }
        return PaperJsonUtils.text(author);
    }

    private static String doi(JsonNode identifiers) {
        if (identifiers == null || !identifiers.isArray()) {
            return null;
        }
        for (JsonNode identifier : identifiers) {
            if (!identifier.isObject()) {
                continue;
            }
            String type = firstPresent(identifier, "type", "idtype");
            if (type != null && "doi".equals(type.toLowerCase(Locale.ROOT))) {
                String value = firstPresent(identifier, "id", "value");
                if (value != null) {
                    String cleaned = DoiUtils.clean(value);
                    return cleaned.isEmpty() ? null : cleaned;
                }
            }
        }
        return null;
    }

    private static String firstLink(JsonNode links) {
        if (links == null || !links.isArray()) {
            return null;
        }
        for (JsonNode link : links) {
            String url = PaperJsonUtils.text(link, "url");
            if (url != null) {
                return url;
            }
        }
        return null;
    }

    private static String firstPresent(JsonNode node, String field, String alternative) {
        String value = PaperJsonUtils.text(node, field);
        return value != null ? value : PaperJsonUtils.text(node, alternative);
    }
}
