/**
 * REST controller exposing literature search and DOI lookup.
 */
package com.williamcallahan.literature_search_engine.controller;

import com.williamcallahan.literature_search_engine.controller.support.ErrorResponseUtils;
import com.williamcallahan.literature_search_engine.exception.AggregationException;
import com.williamcallahan.literature_search_engine.exception.SourceException;
import com.williamcallahan.literature_search_engine.model.Paper;
import com.williamcallahan.literature_search_engine.service.LiteratureAggregatorService;
import com.williamcallahan.literature_search_engine.service.SourceRequestMonitor;
import com.williamcallahan.literature_search_engine.service.source.CrossrefSource;
import com.williamcallahan.literature_search_engine.util.DoiUtils;
import com.williamcallahan.literature_search_engine.util.PagingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/papers")
@Slf4j
public class PaperController {
    private final LiteratureAggregatorService aggregatorService;
    private final CrossrefSource crossrefSource;
    private final SourceRequestMonitor sourceRequestMonitor;

    public PaperController(LiteratureAggregatorService aggregatorService,
                           CrossrefSource crossrefSource,
                           SourceRequestMonitor sourceRequestMonitor) {
        this.aggregatorService = aggregatorService;
        this.crossrefSource = crossrefSource;
        this.sourceRequestMonitor = sourceRequestMonitor;
    }

    /**
     * Title search, or DOI lookup when the query looks like a DOI.
     */
    @GetMapping("/search")
    public Mono<ResponseEntity<SearchResponse>> searchPapers(@RequestParam String query,
                                                             @RequestParam(name = "limit", defaultValue = "0") int limit) {
        String normalizedQuery = query.trim();
        int safeLimit = safeLimit(limit);
        return aggregatorService.search(normalizedQuery, safeLimit)
            .map(results -> ResponseEntity.ok(new SearchResponse(normalizedQuery, safeLimit, results)));
    }

    @GetMapping("/doi")
    public Mono<ResponseEntity<Paper>> lookupDoi(@RequestParam String value) {
        if (!DoiUtils.looksLikeDoi(value)) {
            return Mono.error(new IllegalArgumentException("Not a DOI: " + value.trim()));
        }
        return aggregatorService.lookupDoi(value)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/authors/search")
    public Mono<ResponseEntity<SearchResponse>> searchByAuthor(@RequestParam String author,
                                                               @RequestParam(name = "limit", defaultValue = "0") int limit) {
        String normalizedAuthor = author.trim();
        int safeLimit = safeLimit(limit);
        return crossrefSource.searchByAuthor(normalizedAuthor, safeLimit)
            .map(results -> ResponseEntity.ok(new SearchResponse(normalizedAuthor, safeLimit, results)));
    }

    @GetMapping("/sources")
    public ResponseEntity<Map<String, Object>> sources() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("titleSearchOrder", aggregatorService.getTitleSearchOrder());
        body.put("doiLookupOrder", aggregatorService.getDoiLookupOrder());
        body.put("metrics", sourceRequestMonitor.getMetricsMap());
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(AggregationException.class)
    public ResponseEntity<Map<String, Object>> handleAggregationFailure(AggregationException ex) {
        log.warn("Literature aggregation failed: {} {}", ex.getMessage(), ex.getSourceDiagnostics());
        return ErrorResponseUtils.errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Literature sources unavailable", ex.getMessage());
    }

    @ExceptionHandler(SourceException.class)
    public ResponseEntity<Map<String, Object>> handleSourceFailure(SourceException ex) {
        log.warn("Literature source call failed: {}", ex.getMessage());
        return ErrorResponseUtils.errorResponse(HttpStatus.BAD_GATEWAY, "Literature source unavailable", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return ErrorResponseUtils.errorResponse(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage());
    }

    private int safeLimit(int limit) {
        return PagingUtils.safeLimit(limit, aggregatorService.getDefaultLimit(), 1, aggregatorService.getMaxLimit());
    }

    public record SearchResponse(String query, int limit, List<Paper> results) {
    }
}
