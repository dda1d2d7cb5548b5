package org.tanzu.context7mcp.config;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;

/**
 * Configuration class for the WebClient used to call the Context7 catalog.
 * 
 * Every catalog call gets its own connection: the underlying Reactor Netty client
 * is created with {@link HttpClient#newConnection()}, so nothing is pooled across
 * calls or batches. An optional response timeout and an optional trust-all TLS
 * mode (development only) are applied from {@link Context7Config}.
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /**
     * Creates the WebClient.Builder used by the catalog client.
     * 
     * @param context7Config The Context7 configuration containing TLS and timeout settings
     * @return A configured WebClient.Builder
     * @throws IllegalStateException if the insecure SSL context cannot be built
     */
    @Bean
    public WebClient.Builder webClientBuilder(Context7Config context7Config) {
        logger.info("Configuring WebClient.Builder for Context7 catalog: {} (insecure={}, timeout={})",
                   context7Config.getApiBaseUrl(), context7Config.isInsecure(), context7Config.getRequestTimeout());

        // No connection pool: every catalog call opens its own connection
        HttpClient httpClient = HttpClient.newConnection();

        // Optional per-call response timeout
        if (context7Config.getRequestTimeout() != null) {
            httpClient = httpClient.responseTimeout(context7Config.getRequestTimeout());
        }

        if (context7Config.isInsecure()) {
            try {
                logger.warn("SSL validation is DISABLED for the Context7 catalog (insecure=true). This is not recommended for production!");

                // Create an SSL context that trusts all certificates
                SslContext sslContext = SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();

                // Use the insecure SSL context for catalog calls
                httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
                logger.debug("Created HttpClient with insecure SSL context");
            } catch (SSLException e) {
                logger.error("Failed to configure insecure SSL context: {}", e.getMessage(), e);
                throw new IllegalStateException("Failed to configure insecure SSL context", e);
            }
        } else {
            logger.info("Using default SSL validation for the Context7 catalog");
        }

        // Wire the customized HttpClient into the builder
        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
