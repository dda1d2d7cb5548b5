package org.tanzu.context7mcp.context7;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.tanzu.context7mcp.config.Context7Config;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Map;
import java.util.Set;

/**
 * Client for the Context7 catalog REST API.
 * 
 * The client supports the two catalog operations:
 * - search: GET {base}/v1/search?query={name}, JSON response
 * - fetchDocs: GET {base}/v1/{libraryId}?tokens={n}&topic={t}&type=txt, plain text response
 * 
 * Neither operation raises on a non-success status. Search returns an empty
 * result tagged with the status code; fetch returns an UPSTREAM_ERROR lookup.
 * The catalog also answers "nothing found" with status 200 and a placeholder
 * body; those bodies are mapped to NOT_FOUND here so no caller sees them.
 * 
 * All methods return cold Monos; nothing is sent until subscription.
 */
@Component
public class CatalogClient {

    private static final Logger logger = LoggerFactory.getLogger(CatalogClient.class);

    public static final String SOURCE_HEADER = "X-Context7-Source";
    public static final String SOURCE_VALUE = "mcp-server";

    /** Bodies the catalog returns with status 200 when it has no documentation */
    static final Set<String> NO_CONTENT_SENTINELS = Set.of("No content available", "No context data available");

    private final Context7Config context7Config;
    private final WebClient webClient;
    private final IdentityHeaderBuilder headerBuilder;

    public CatalogClient(Context7Config context7Config,
                         WebClient.Builder webClientBuilder,
                         IdentityHeaderBuilder headerBuilder) {
        this.context7Config = context7Config;
        this.webClient = webClientBuilder.build();
        this.headerBuilder = headerBuilder;
        logger.info("Initializing CatalogClient for Context7 catalog: {}", context7Config.getApiBaseUrl());
    }

    /**
     * Searches the catalog for libraries matching a name.
     * 
     * @param name search term, e.g. "FastAPI"
     * @param clientAddress caller address for the identity header, or null
     * @param credential bearer credential, or null
     * @return the decoded result, or an empty result tagged with the status code
     */
    public Mono<CatalogSearchResult> search(String name, String clientAddress, String credential) {
        return Mono.defer(() -> {
            // Values go in as template variables so reserved characters such as '+' are percent-encoded
            URI uri = UriComponentsBuilder.fromUriString(context7Config.getApiBaseUrl())
                .path("/v1/search")
                .queryParam("query", "{query}")
                .encode()
                .buildAndExpand(name)
                .toUri();
            Map<String, String> headers = headerBuilder.buildHeaders(clientAddress, credential, null);
            logger.debug("Catalog search request: {}", uri);

            return webClient.get()
                .uri(uri)
                .headers(h -> headers.forEach(h::set))
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> {
                    // Success: decode the result list as-is
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(CatalogSearchResult.class)
                            .defaultIfEmpty(CatalogSearchResult.empty());
                    }
                    // Any other status becomes an empty result tagged with the code; callers decide what it means
                    int status = response.statusCode().value();
                    logger.warn("Catalog search for '{}' failed with status {}", name, status);
                    return response.releaseBody().thenReturn(CatalogSearchResult.upstreamError(status));
                })
                .doOnNext(result -> logger.debug("Catalog search for '{}' returned {} hits",
                    name, result.getResults().size()));
        });
    }

    /**
     * Fetches documentation text for one library.
     * 
     * The library id loses one leading "/" and the token budget is raised to the
     * configured minimum before the request is sent.
     * 
     * @param request library id, token budget and topic
     * @param clientAddress caller address for the identity header, or null
     * @param credential bearer credential, or null
     * @return FOUND with the documentation text, NOT_FOUND for placeholder or empty
     *         bodies, UPSTREAM_ERROR for a non-success status
     */
    public Mono<CatalogLookup<String>> fetchDocs(DocumentationRequest request, String clientAddress, String credential) {
        return Mono.defer(() -> {
            // The library id stays part of the path template so its '/' separators survive;
            // query values are expanded as variables and strictly encoded
            Map<String, Object> queryValues = Map.of(
                "tokens", request.getEffectiveTokenBudget(context7Config.getMinimumTokens()),
                "topic", request.getTopic());
            URI uri = UriComponentsBuilder.fromUriString(context7Config.getApiBaseUrl())
                .path("/v1/")
                .path(request.getNormalizedLibraryId())
                .queryParam("tokens", "{tokens}")
                .queryParam("topic", "{topic}")
                .queryParam("type", "txt")
                .encode()
                .buildAndExpand(queryValues)
                .toUri();
            Map<String, String> headers = headerBuilder.buildHeaders(
                clientAddress, credential, Map.of(SOURCE_HEADER, SOURCE_VALUE));
            logger.debug("Catalog docs request: {}", uri);

            return webClient.get()
                .uri(uri)
                .headers(h -> headers.forEach(h::set))
                .exchangeToMono(response -> {
                    // Status 200 may still carry a "no content" placeholder; toLookup maps it to NOT_FOUND
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(text -> toLookup(request, text));
                    }
                    // Non-success status: release the connection and report an upstream error
                    int status = response.statusCode().value();
                    logger.warn("Catalog docs request for '{}' failed with status {}", request.getLibraryId(), status);
                    return response.releaseBody()
                        .thenReturn(CatalogLookup.<String>upstreamError("Catalog returned status " + status));
                });
        });
    }

    private static CatalogLookup<String> toLookup(DocumentationRequest request, String text) {
        if (text.isEmpty() || NO_CONTENT_SENTINELS.contains(text)) {
            logger.info("No documentation available for '{}' (topic '{}')", request.getLibraryId(), request.getTopic());
            return CatalogLookup.notFound("No documentation available");
        }
        return CatalogLookup.found(text);
    }
}
