/**
 * Shared HTTP transport for all literature sources
 *
 * @author William Callahan
 *
 * Features:
 * - Owns a bounded Reactor Netty connection pool used by every source client
 * - Applies a connect timeout and a 10MB in-memory response buffer
 * - Releases pooled connections when closed at application shutdown
 */
package com.williamcallahan.literature_search_engine.service.source;

import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

public class LiteratureHttpTransport implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LiteratureHttpTransport.class);
    private static final int MAX_IN_MEMORY_SIZE = 10 * 1024 * 1024;

    private final ConnectionProvider connectionProvider;
    private final WebClient webClient;
    private volatile boolean closed;

    public LiteratureHttpTransport(Duration connectTimeout, int maxConnections) {
        this.connectionProvider = ConnectionProvider.builder("literature-sources")
            .maxConnections(Math.max(1, maxConnections))
            .maxIdleTime(Duration.ofSeconds(30))
            .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
            .followRedirect(true)
            .compress(true);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_IN_MEMORY_SIZE))
            .build();

        this.webClient = WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    public WebClient webClient() {
        return webClient;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        connectionProvider.dispose();
        logger.info("Literature HTTP transport closed");
    }
}
