/**
 * Orchestrates title searches and DOI lookups across the registered literature sources
 *
 * @author William Callahan
 *
 * Features:
 * - Routes DOI-looking queries to lookup and everything else to title search
 * - Consults sources strictly one at a time in priority order
 * - Deduplicates by DOI or normalized title and stops as soon as the limit is met
 * - First DOI hit wins; later sources are never called
 * - Distinguishes "every source failed" from "nothing exists"
 */
package com.williamcallahan.literature_search_engine.service;

import com.williamcallahan.literature_search_engine.exception.AggregationException;
import com.williamcallahan.literature_search_engine.exception.SourceException;
import com.williamcallahan.literature_search_engine.model.Paper;
import com.williamcallahan.literature_search_engine.service.source.LiteratureSource;
import com.williamcallahan.literature_search_engine.util.DoiUtils;
import com.williamcallahan.literature_search_engine.util.ExternalApiLogger;
import com.williamcallahan.literature_search_engine.util.PagingUtils;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class LiteratureAggregatorService {

    public static final int DEFAULT_LIMIT = 5;
    public static final int DEFAULT_MAX_LIMIT = 20;

    static final String NO_RESULTS_MESSAGE = "no source returned results";
    static final String DOI_FAILED_MESSAGE = "no source could be queried for this DOI";

    private final List<LiteratureSource> titleOrder;
    private final List<LiteratureSource> doiOrder;
    private final int defaultLimit;
    private final int maxLimit;

    public LiteratureAggregatorService(List<SourceRegistration> registrations) {
        this(registrations, DEFAULT_LIMIT, DEFAULT_MAX_LIMIT);
    }

    public LiteratureAggregatorService(List<SourceRegistration> registrations, int defaultLimit, int maxLimit) {
        this.titleOrder = registrations.stream()
            .filter(SourceRegistration::supportsTitleSearch)
            .map(SourceRegistration::source)
            .collect(Collectors.toUnmodifiableList());
        this.doiOrder = registrations.stream()
            .filter(SourceRegistration::supportsDoiLookup)
            .map(SourceRegistration::source)
            .collect(Collectors.toUnmodifiableList());
        this.maxLimit = Math.max(1, maxLimit);
        this.defaultLimit = PagingUtils.clamp(defaultLimit, 1, this.maxLimit);
        log.info("Literature aggregator ready: title order {}, DOI order {}", names(titleOrder), names(doiOrder));
    }

    /**
     * Single entry point: DOI lookup when {@code query} looks like a DOI, title search otherwise.
     *
     * @param query title text or DOI in any accepted form
     * @param limit maximum records; non-positive means the default
     * @return at most {@code limit} records, or an {@link AggregationException} error signal
     */
    public Mono<List<Paper>> search(String query, int limit) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty()) {
            return Mono.just(List.of());
        }
        if (DoiUtils.looksLikeDoi(trimmed)) {
            return lookupDoi(trimmed)
                .map(List::of)
                .defaultIfEmpty(List.of());
        }
        return searchByTitle(trimmed, limit);
    }

    public Mono<List<Paper>> searchByTitle(String title, int limit) {
        String query = title == null ? "" : title.trim();
        if (query.isEmpty()) {
            return Mono.just(List.of());
        }
        int rows = resolveLimit(limit);
        return Mono.defer(() -> {
            Set<String> seenKeys = new HashSet<>();
            List<String> failures = Collections.synchronizedList(new ArrayList<>());
            ExternalApiLogger.logAggregationStart(log, "searchByTitle", query, titleOrder.size(), rows);

            return Flux.fromIterable(titleOrder)
                .concatMap(source -> attemptTitleSearch(source, query, rows, failures))
                .filter(paper -> seenKeys.add(paper.key()))
                .take(rows)
                .collectList()
                .flatMap(results -> {
                    ExternalApiLogger.logAggregationComplete(log, "searchByTitle", query, results.size(), failures.size());
                    if (results.isEmpty() && !failures.isEmpty()) {
                        return Mono.error(new AggregationException(NO_RESULTS_MESSAGE, failures));
                    }
                    return Mono.just(results);
                });
        });
    }

    /**
     * Ordered fallback across DOI-capable sources; the first record found wins.
     *
     * @return the record, empty when no source knows the DOI (or some sources failed and the rest
     *         did not know it), or an {@link AggregationException} when every source failed
     */
    public Mono<Paper> lookupDoi(String doi) {
        String cleaned = DoiUtils.clean(doi);
        if (cleaned.isEmpty()) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            List<String> failures = Collections.synchronizedList(new ArrayList<>());
            ExternalApiLogger.logAggregationStart(log, "lookupDoi", cleaned, doiOrder.size(), 1);

            return Flux.fromIterable(doiOrder)
                .concatMap(source -> attemptDoiLookup(source, cleaned, failures))
                .next()
                .map(paper -> paper.withDoi(DoiUtils.clean(paper.hasDoi() ? paper.doi() : cleaned)))
                .doOnNext(paper -> ExternalApiLogger.logAggregationComplete(log, "lookupDoi", cleaned, 1, failures.size()))
                .switchIfEmpty(Mono.defer(() -> {
                    ExternalApiLogger.logAggregationComplete(log, "lookupDoi", cleaned, 0, failures.size());
                    if (!doiOrder.isEmpty() && failures.size() == doiOrder.size()) {
                        return Mono.error(new AggregationException(DOI_FAILED_MESSAGE, failures));
                    }
                    return Mono.empty();
                }));
        });
    }

    private Flux<Paper> attemptTitleSearch(LiteratureSource source, String query, int rows, List<String> failures) {
        return Mono.defer(() -> {
                ExternalApiLogger.logApiCallAttempt(log, source.name(), "searchByTitle", query, false);
                return source.searchByTitle(query, rows);
            })
            .defaultIfEmpty(List.of())
            .doOnNext(papers -> ExternalApiLogger.logApiCallSuccess(log, source.name(), "searchByTitle", query, papers.size()))
            .flatMapMany(Flux::fromIterable)
            .onErrorResume(error -> {
                recordFailure(source, "searchByTitle", query, error, failures);
                return Flux.empty();
            });
    }

    private Mono<Paper> attemptDoiLookup(LiteratureSource source, String doi, List<String> failures) {
        return Mono.defer(() -> {
                ExternalApiLogger.logApiCallAttempt(log, source.name(), "lookupDoi", doi, false);
                return source.lookupByDoi(doi);
            })
            .doOnNext(paper -> ExternalApiLogger.logApiCallSuccess(log, source.name(), "lookupDoi", doi, 1))
            .switchIfEmpty(Mono.<Paper>fromRunnable(() -> ExternalApiLogger.logNotFound(log, source.name(), "lookupDoi", doi)))
            .onErrorResume(error -> {
                recordFailure(source, "lookupDoi", doi, error, failures);
                return Mono.empty();
            });
    }

    private void recordFailure(LiteratureSource source, String operation, String query, Throwable error, List<String> failures) {
        String diagnostic;
        if (error instanceof SourceException sourceException) {
            diagnostic = sourceException.getMessage();
        } else {
            diagnostic = source.name() + ": unexpected error (" + error.getClass().getSimpleName() + ")";
            log.debug("Unexpected failure from {}", source.name(), error);
        }
        failures.add(diagnostic);
        ExternalApiLogger.logApiCallFailure(log, source.name(), operation, query, diagnostic);
    }

    int resolveLimit(int requested) {
        return PagingUtils.safeLimit(requested, defaultLimit, 1, maxLimit);
    }

    public List<String> getTitleSearchOrder() {
        return names(titleOrder);
    }

    public List<String> getDoiLookupOrder() {
        return names(doiOrder);
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    private static List<String> names(List<LiteratureSource> sources) {
        return sources.stream().map(LiteratureSource::name).collect(Collectors.toUnmodifiableList());
    }
}
