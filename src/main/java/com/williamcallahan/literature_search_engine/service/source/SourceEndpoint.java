package com.williamcallahan.literature_search_engine.service.source;

import com.williamcallahan.literature_search_engine.util.ValidationUtils;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection settings for one literature source: where it lives, how long a call may take,
 * how far apart calls must start, and the headers and query parameters sent with every request.
 */
public record SourceEndpoint(
    String name,
    String baseUrl,
    Duration timeout,
    Duration minInterval,
    String userAgent,
    Map<String, String> headers,
    Map<String, String> params
) {

    public SourceEndpoint {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static SourceEndpoint of(String name, String baseUrl, Duration timeout, Duration minInterval, String userAgent) {
        return new SourceEndpoint(name, stripTrailingSlash(baseUrl), timeout, minInterval, userAgent, Map.of(), Map.of());
    }

    /**
     * Copy with an extra default header. Blank values are ignored so optional keys can be passed through as-is.
     */
    public SourceEndpoint withHeader(String header, String value) {
        if (!ValidationUtils.hasText(value)) {
            return this;
        }
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(header, value.trim());
        return new SourceEndpoint(name, baseUrl, timeout, minInterval, userAgent, copy, params);
    }

    /**
     * Copy with an extra default query parameter. Blank values are ignored.
     */
    public SourceEndpoint withParam(String param, String value) {
        if (!ValidationUtils.hasText(value)) {
            return this;
        }
        Map<String, String> copy = new LinkedHashMap<>(params);
        copy.put(param, value.trim());
        return new SourceEndpoint(name, baseUrl, timeout, minInterval, userAgent, headers, copy);
    }

    public SourceEndpoint withBaseUrl(String newBaseUrl) {
        if (!ValidationUtils.hasText(newBaseUrl)) {
            return this;
        }
        return new SourceEndpoint(name, stripTrailingSlash(newBaseUrl.trim()), timeout, minInterval, userAgent, headers, params);
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
