/**
 * Configuration for the outbound HTTP transport
 * - Creates the single transport shared by every literature source
 * - Closes its connection pool when the context shuts down
 *
 * @author William Callahan
 */
package com.williamcallahan.literature_search_engine.config;

import com.williamcallahan.literature_search_engine.service.source.LiteratureHttpTransport;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    /**
     * Shared transport bean
     * - Connect timeout and pool size from {@code literature.transport.*}
     * - Per-source request timeouts are applied by each source client
     *
     * @return the transport, closed by Spring on shutdown
     */
    @Bean(destroyMethod = "close")
    public LiteratureHttpTransport literatureHttpTransport(LiteratureSourcesProperties properties) {
        LiteratureSourcesProperties.Transport transport = properties.getTransport();
        Duration connectTimeout = transport.getConnectTimeout() != null ? transport.getConnectTimeout() : Duration.ofSeconds(5);
        return new LiteratureHttpTransport(connectTimeout, transport.getMaxConnections());
    }
}
