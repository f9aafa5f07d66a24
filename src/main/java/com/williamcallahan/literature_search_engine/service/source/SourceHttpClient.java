/**
 * Rate-limited JSON GET client bound to one literature source
 *
 * @author William Callahan
 *
 * Features:
 * - Waits for the source's rate limiter before every request
 * - Enforces the source's per-request timeout
 * - Maps HTTP errors, timeouts and transport failures to SourceException diagnostics
 * - Optionally treats 404 as an empty result for path-based lookups
 * - Records every outcome in SourceRequestMonitor
 */
package com.williamcallahan.literature_search_engine.service.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.literature_search_engine.exception.SourceException;
import com.williamcallahan.literature_search_engine.service.SourceRequestMonitor;
import com.williamcallahan.literature_search_engine.util.ExternalApiLogger;
import com.williamcallahan.literature_search_engine.util.ValidationUtils;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

public class SourceHttpClient {

    private static final Logger logger = LoggerFactory.getLogger(SourceHttpClient.class);
    static final int MAX_ERROR_BODY_CHARS = 300;

    private final SourceEndpoint endpoint;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final SourceRequestMonitor monitor;
    private final SourceRateLimiter rateLimiter;

    public SourceHttpClient(SourceEndpoint endpoint, WebClient webClient, ObjectMapper objectMapper, SourceRequestMonitor monitor) {
        this(endpoint, webClient, objectMapper, monitor, new SourceRateLimiter(endpoint.minInterval()));
    }

    public SourceHttpClient(SourceEndpoint endpoint,
                            WebClient webClient,
                            ObjectMapper objectMapper,
                            SourceRequestMonitor monitor,
                            SourceRateLimiter rateLimiter) {
        this.endpoint = endpoint;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.monitor = monitor;
        this.rateLimiter = rateLimiter;
    }

    public Mono<JsonNode> getJson(String encodedPath, Map<String, ?> params) {
        return getJson(encodedPath, params, false);
    }

    /**
     * GETs {@code baseUrl + encodedPath} with the endpoint's default parameters merged under {@code params}.
     *
     * @param encodedPath path already percent-encoded by the caller, may be empty
     * @param params query parameters; null values are skipped
     * @param emptyOnNotFound complete empty on HTTP 404 instead of failing
     * @return parsed JSON body; errors are always {@link SourceException}
     */
    public Mono<JsonNode> getJson(String encodedPath, Map<String, ?> params, boolean emptyOnNotFound) {
        String name = endpoint.name();
        URI uri = buildUri(encodedPath, params);
        return rateLimiter.acquire()
            .then(Mono.defer(() -> exchange(uri, emptyOnNotFound).timeout(endpoint.timeout())))
            .onErrorMap(e -> !(e instanceof SourceException), this::toSourceException)
            .doOnSuccess(node -> {
                if (node == null) {
                    monitor.recordNotFound(name);
                } else {
                    monitor.recordSuccessfulRequest(name);
                }
            })
            .doOnError(SourceException.class, e -> monitor.recordFailedRequest(name, e.getDiagnostic()));
    }

    private Mono<JsonNode> exchange(URI uri, boolean emptyOnNotFound) {
        ExternalApiLogger.logHttpRequest(logger, "GET", uri.toString(), isAuthenticated());
        return webClient.get()
            .uri(uri)
            .accept(MediaType.APPLICATION_JSON)
            .headers(this::applyHeaders)
            .exchangeToMono(response -> {
                int status = response.statusCode().value();
                if (status == HttpStatus.NOT_FOUND.value() && emptyOnNotFound) {
                    ExternalApiLogger.logHttpResponse(logger, status, uri.toString(), 0);
                    return response.releaseBody().then(Mono.<JsonNode>empty());
                }
                return response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(body -> {
                        ExternalApiLogger.logHttpResponse(logger, status, uri.toString(), body.length());
                        if (!response.statusCode().is2xxSuccessful()) {
                            String excerpt = ValidationUtils.truncate(body.trim(), MAX_ERROR_BODY_CHARS);
                            return Mono.error(new SourceException(endpoint.name(), "HTTP " + status + ": " + excerpt));
                        }
                        return parse(body);
                    });
            });
    }

    private Mono<JsonNode> parse(String body) {
        if (body.isBlank()) {
            return Mono.error(new SourceException(endpoint.name(), SourceException.UNPARSEABLE));
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || node.isMissingNode() || node.isNull()) {
                return Mono.error(new SourceException(endpoint.name(), SourceException.UNPARSEABLE));
            }
            return Mono.just(node);
        } catch (JsonProcessingException e) {
            return Mono.error(new SourceException(endpoint.name(), SourceException.UNPARSEABLE, e));
        }
    }

    private void applyHeaders(HttpHeaders headers) {
        if (ValidationUtils.hasText(endpoint.userAgent())) {
            headers.set(HttpHeaders.USER_AGENT, endpoint.userAgent());
        }
        endpoint.headers().forEach(headers::set);
    }

    private boolean isAuthenticated() {
        return !endpoint.headers().isEmpty();
    }

    URI buildUri(String encodedPath, Map<String, ?> params) {
        Map<String, Object> merged = new LinkedHashMap<>(endpoint.params());
        if (params != null) {
            merged.putAll(params);
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(endpoint.baseUrl() + (encodedPath == null ? "" : encodedPath));
        merged.forEach((key, value) -> {
            if (value != null) {
                builder.queryParam(encodeQuery(key), encodeQuery(String.valueOf(value)));
            }
        });
        return builder.build(true).toUri();
    }

    // '+' is legal in a query but decoded as a space by most servers
    private static String encodeQuery(String value) {
        return UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8).replace("+", "%2B");
    }

    private SourceException toSourceException(Throwable error) {
        if (hasCause(error, TimeoutException.class)
                || hasCause(error, ReadTimeoutException.class)
                || hasCause(error, ConnectTimeoutException.class)) {
            return new SourceException(endpoint.name(), SourceException.TIMEOUT, error);
        }
        logger.debug("Transport failure calling {}: {}", endpoint.name(), error.toString());
        return new SourceException(endpoint.name(), SourceException.NETWORK_ERROR, error);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
