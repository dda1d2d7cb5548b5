package org.tanzu.context7mcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration class for the Context7 catalog connection and retrieval settings.
 * 
 * This class uses Spring Boot's @ConfigurationProperties to bind settings from:
 * - application.properties file
 * - Environment variables (CONTEXT7_API_KEY, CLIENT_IP_ENCRYPTION_KEY, ...)
 * - Cloud Foundry service bindings (via Context7ConfigProcessor)
 * 
 * Properties are bound using the "context7" prefix, so "context7.api-base-url",
 * "context7.minimum-tokens" and so on map onto this class. The bean is injected
 * into every component that talks to the catalog; nothing reads these values
 * from static state.
 */
@Component
@ConfigurationProperties(prefix = "context7")
public class Context7Config {

    /** Base URL of the Context7 catalog API, without the /v1 suffix */
    private String apiBaseUrl = "https://context7.com/api";

    /** Bearer credential sent to the catalog (optional) */
    private String apiKey;

    /** Hex-encoded AES key used to encrypt the caller address */
    private String clientIpEncryptionKey;

    /** Token budget used when a request does not specify one */
    private int defaultTokens = 10000;

    /** Lower bound applied to every requested token budget */
    private int minimumTokens = 1000;

    /** Maximum number of catalog calls in flight for one multi-library request */
    private int maxConcurrency = 8;

    /** Per-call response timeout; null disables it */
    private Duration requestTimeout;

    /** Whether to skip TLS certificate validation towards the catalog (default: false) */
    private boolean insecure = false;

    public String getApiBaseUrl() { return apiBaseUrl; }
    public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getClientIpEncryptionKey() { return clientIpEncryptionKey; }
    public void setClientIpEncryptionKey(String clientIpEncryptionKey) { this.clientIpEncryptionKey = clientIpEncryptionKey; }

    public int getDefaultTokens() { return defaultTokens; }
    public void setDefaultTokens(int defaultTokens) { this.defaultTokens = defaultTokens; }

    public int getMinimumTokens() { return minimumTokens; }
    public void setMinimumTokens(int minimumTokens) { this.minimumTokens = minimumTokens; }

    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public boolean isInsecure() { return insecure; }
    public void setInsecure(boolean insecure) { this.insecure = insecure; }

    /**
     * Returns a string representation of the configuration.
     * 
     * The API key and the encryption key are hidden so they never end up in
     * logs or debug output.
     * 
     * @return String representation with secrets hidden
     */
    @Override
    public String toString() {
        return "Context7Config{" +
                "apiBaseUrl='" + apiBaseUrl + '\'' +
                ", apiKey='" + (apiKey != null && !apiKey.isEmpty() ? "[HIDDEN]" : "") + '\'' +
                ", clientIpEncryptionKey='[HIDDEN]'" +
                ", defaultTokens=" + defaultTokens +
                ", minimumTokens=" + minimumTokens +
                ", maxConcurrency=" + maxConcurrency +
                ", requestTimeout=" + requestTimeout +
                ", insecure=" + insecure +
                '}';
    }
}
