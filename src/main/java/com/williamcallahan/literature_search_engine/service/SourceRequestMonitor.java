/**
 * Service for monitoring literature source call metrics
 * - Tracks successful, failed and not-found calls per source
 * - Remembers the last failure diagnostic for each source
 * - Exposes a snapshot map for the sources endpoint
 *
 * @author William Callahan
 */
package com.williamcallahan.literature_search_engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class SourceRequestMonitor {
    private static final Logger logger = LoggerFactory.getLogger(SourceRequestMonitor.class);
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong totalSuccessful = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);

    private final Map<String, SourceCounters> perSource = new ConcurrentHashMap<>();

    /**
     * Records a call that returned a usable response
     * @param source the source name, e.g. {@code crossref}
     */
    public void recordSuccessfulRequest(String source) {
        totalRequests.incrementAndGet();
        totalSuccessful.incrementAndGet();
        counters(source).successful.incrementAndGet();
    }

    /**
     * Records a lookup the source answered with "no such record". Counted as a successful request.
     */
    public void recordNotFound(String source) {
        recordSuccessfulRequest(source);
        counters(source).notFound.incrementAndGet();
    }

    /**
     * Records a failed call
     * @param source the source name
     * @param diagnostic short reason such as {@code timeout} or {@code HTTP 503: ...}
     */
    public void recordFailedRequest(String source, String diagnostic) {
        totalRequests.incrementAndGet();
        totalFailed.incrementAndGet();
        SourceCounters counters = counters(source);
        counters.failed.incrementAndGet();
        counters.lastFailure = diagnostic;
        counters.lastFailureAt = LocalDateTime.now();
        logger.debug("Failed request to source {}: {}", source, diagnostic);
    }

    /**
     * Snapshot of all counters, sources sorted by name.
     */
    public Map<String, Object> getMetricsMap() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_requests", totalRequests.get());
        metrics.put("total_successful", totalSuccessful.get());
        metrics.put("total_failed", totalFailed.get());

        Map<String, Map<String, Object>> sources = new TreeMap<>();
        perSource.forEach((name, counters) -> sources.put(name, counters.toMap()));
        metrics.put("sources", sources);
        return metrics;
    }

    public void resetMetrics() {
        totalRequests.set(0);
        totalSuccessful.set(0);
        totalFailed.set(0);
        perSource.clear();
        logger.info("Source request metrics reset");
    }

    private SourceCounters counters(String source) {
        return perSource.computeIfAbsent(source, k -> new SourceCounters());
    }

    private static final class SourceCounters {
        private final AtomicLong successful = new AtomicLong(0);
        private final AtomicLong failed = new AtomicLong(0);
        private final AtomicLong notFound = new AtomicLong(0);
        private volatile String lastFailure;
        private volatile LocalDateTime lastFailureAt;

        private Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("successful", successful.get());
            map.put("failed", failed.get());
            map.put("not_found", notFound.get());
            String failure = lastFailure;
            LocalDateTime failureAt = lastFailureAt;
            if (failure != null) {
                map.put("last_failure", failure);
                map.put("last_failure_at", failureAt == null ? null : failureAt.format(TIME_FORMATTER));
            }
            return map;
        }
    }
}
