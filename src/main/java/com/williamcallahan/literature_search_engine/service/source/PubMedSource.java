/**
 * NCBI E-utilities (PubMed) adapter
 *
 * @author William Callahan
 *
 * Features:
 * - Two-step flow: esearch for PMIDs, then esummary for the records
 * - Title search with the [ti] field tag, DOI lookup with [AID]
 * - tool, email and api_key parameters added to every call by the endpoint
 * - Year extracted from the free-form pubdate string
 */
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
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PubMedSource implements LiteratureSource {

    public static final String NAME = "pubmed";
    public static final String BASE_URL = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
    public static final Duration TIMEOUT = Duration.ofSeconds(16);
    public static final String DEFAULT_TOOL = "paper-finder";

    private static final String RECORD_URL = "https://pubmed.ncbi.nlm.nih.gov/";
    private static final Pattern YEAR = Pattern.compile("(19\\d{2}|20\\d{2})");

    private final SourceHttpClient http;

    public PubMedSource(SourceHttpClient http) {
        this.http = http;
    }

    /**
     * NCBI allows 10 requests a second with a key and 3 without.
     */
    public static Duration minInterval(boolean hasApiKey) {
        return hasApiKey ? Duration.ofMillis(120) : Duration.ofMillis(340);
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
        return esearch(title.trim() + "[ti]", limit)
            .flatMap(ids -> esummary(ids, limit));
    }

    @Override
    public Mono<Paper> lookupByDoi(String doi) {
        String cleaned = DoiUtils.clean(doi);
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        return esearch(cleaned + "[AID]", 1)
            .flatMap(ids -> esummary(ids, 1))
            .flatMap(papers -> papers.isEmpty() ? Mono.empty() : Mono.just(papers.get(0)));
    }

    private Mono<List<String>> esearch(String term, int retmax) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("db", "pubmed");
        params.put("term", term);
        params.put("retmode", "json");
        params.put("retmax", retmax);
        params.put("sort", "relevance");
        return http.getJson("/esearch.fcgi", params)
            .map(node -> {
                List<String> ids = new ArrayList<>();
                JsonNode idList = node.path("esearchresult").path("idlist");
                if (idList.isArray()) {
                    for (JsonNode id : idList) {
                        String value = id.isValueNode() ? id.asText().trim() : "";
                        if (!value.isEmpty()) {
                            ids.add(value);
                        }
                    }
                }
                return ids;
            });
    }

    private Mono<List<Paper>> esummary(List<String> ids, int limit) {
        if (ids.isEmpty()) {
            return Mono.just(List.of());
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("db", "pubmed");
        params.put("id", String.join(",", ids));
        params.put("retmode", "json");
        return http.getJson("/esummary.fcgi", params)
            .map(node -> {
                JsonNode result = node.path("result");
                List<Paper> papers = new ArrayList<>();
                JsonNode uids = result.path("uids");
                if (!uids.isArray()) {
                    return papers;
                }
                for (JsonNode uid : uids) {
                    if (papers.size() >= limit) {
                        break;
                    }
                    String id = uid.asText().trim();
                    JsonNode summary = result.get(id);
                    if (id.isEmpty() || summary == null || !summary.isObject()) {
                        continue;
                    }
                    papers.add(toPaper(id, summary));
                }
                return papers;
            });
    }

    static Paper toPaper(String uid, JsonNode summary) {
        return new Paper(
            PaperJsonUtils.text(summary, "title"),
            year(PaperJsonUtils.text(summary, "pubdate")),
            doi(summary.get("articleids")),
            RECORD_URL + uid + "/",
            PaperJsonUtils.authorsFromArray(summary.get("authors"), author -> PaperJsonUtils.text(author, "name")),
            NAME,
            null
        );
    }

    private static Integer year(String pubdate) {
        if (pubdate == null) {
            return null;
        }
        Matcher matcher = YEAR.matcher(pubdate);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    private static String doi(JsonNode articleIds) {
        if (articleIds == null || !articleIds.isArray()) {
            return null;
        }
        for (JsonNode articleId : articleIds) {
            String idType = PaperJsonUtils.text(articleId, "idtype");
            if (idType != null && "doi".equals(idType.toLowerCase(Locale.ROOT))) {
                String value = PaperJsonUtils.doi(articleId, "value");
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }
}
