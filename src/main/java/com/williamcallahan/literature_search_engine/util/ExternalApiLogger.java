package com.williamcallahan.literature_search_engine.util;

import org.slf4j.Logger;

/**
 * Centralized logging for calls to external literature sources.
 *
 * These logs help debug the sequential aggregation flow:
 * - one ATTEMPT/SUCCESS/FAILURE line per source call
 * - HTTP request and response lines at debug level
 * - a START/COMPLETE pair per aggregated search
 */
public class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query, boolean authenticated) {
        String authType = authenticated ? "AUTHENTICATED" : "UNAUTHENTICATED";
        log.info("{} [{}] {} ATTEMPT: {} for query='{}'", PREFIX, apiName, authType, operation, query);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info("{} [{}] SUCCESS: {} returned {} result(s) for query='{}'", PREFIX, apiName, operation, resultCount, query);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for query='{}' - {}", PREFIX, apiName, operation, query, reason);
    }

    public static void logNotFound(Logger log, String apiName, String operation, String query) {
        log.info("{} [{}] NOT-FOUND: {} for query='{}'", PREFIX, apiName, operation, query);
    }

    /**
     * Log the start of an aggregated search across sources
     */
    public static void logAggregationStart(Logger log, String operation, String query, int sourceCount, int limit) {
        log.info("{} [AGGREGATE] START: {} query='{}', sources={}, limit={}", PREFIX, operation, query, sourceCount, limit);
    }

    /**
     * Log the completion of an aggregated search
     */
    public static void logAggregationComplete(Logger log, String operation, String query, int resultCount, int failedSources) {
        log.info("{} [AGGREGATE] COMPLETE: {} query='{}', results={}, failedSources={}", PREFIX, operation, query, resultCount, failedSources);
    }

    /**
     * Log HTTP request details
     */
    public static void logHttpRequest(Logger log, String method, String url, boolean authenticated) {
        String authType = authenticated ? "AUTHENTICATED" : "UNAUTHENTICATED";
        log.debug("{} [HTTP] {} {} request to: {}", PREFIX, authType, method, url);
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, int statusCode, String url, int bodySize) {
        log.debug("{} [HTTP] Response: status={}, url={}, bodySize={} bytes", PREFIX, statusCode, url, bodySize);
    }
}
