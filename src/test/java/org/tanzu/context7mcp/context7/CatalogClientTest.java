package org.tanzu.context7mcp.context7;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.tanzu.context7mcp.config.Context7Config;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogClientTest {

    private static final String SEARCH_JSON = "{\"results\":[{\"title\":\"FastAPI\",\"id\":\"/tiangolo/fastapi\","
        + "\"description\":\"Web framework\",\"totalSnippets\":10,\"versions\":[\"0.110\"]}]}";

    private StubCatalogExchange catalog;
    private Context7Config config;
    private CatalogClient client;

    @BeforeEach
    void setUp() {
        catalog = new StubCatalogExchange();
        config = new Context7Config();
        config.setApiBaseUrl("http://catalog.test/api");
        config.setClientIpEncryptionKey("000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f");
        config.setMinimumTokens(1000);
        client = new CatalogClient(config, catalog.webClientBuilder(), new IdentityHeaderBuilder(config));
    }

    @Test
    void search_returnsDecodedHits() {
        catalog.onSearch("fastapi", HttpStatus.OK, SEARCH_JSON);

        CatalogSearchResult result = client.search("fastapi", null, "key-1").block();

        assertThat(result.getResults()).hasSize(1);
        assertThat(result.getResults().get(0).getId()).isEqualTo("/tiangolo/fastapi");
        assertThat(result.getResults().get(0).getVersions()).containsExactly("0.110");
        assertThat(result.getError()).isNull();

        ClientRequest request = catalog.lastRequest();
        assertThat(request.url().getPath()).isEqualTo("/api/v1/search");
        assertThat(StubCatalogExchange.queryParam(request, "query")).isEqualTo("fastapi");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer key-1");
        assertThat(request.headers().containsKey(IdentityHeaderBuilder.CLIENT_IP_HEADER)).isFalse();
        assertThat(request.headers().containsKey(CatalogClient.SOURCE_HEADER)).isFalse();
    }

    @Test
    void search_encodesPlusInQuery() {
        catalog.onSearch("c++", HttpStatus.OK, SEARCH_JSON);

        CatalogSearchResult result = client.search("c++", null, null).block();

        assertThat(result.getResults()).hasSize(1);
        assertThat(catalog.lastRequest().url().getRawQuery()).isEqualTo("query=c%2B%2B");
        assertThat(StubCatalogExchange.queryParam(catalog.lastRequest(), "query")).isEqualTo("c++");
    }

    @Test
    void search_nonSuccessStatusBecomesTaggedEmptyResult() {
        catalog.onSearch("fastapi", HttpStatus.SERVICE_UNAVAILABLE, "{\"message\":\"down\"}");

        CatalogSearchResult result = client.search("fastapi", null, null).block();

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getError()).isEqualTo("503");
        assertThat(result.toLookup().getStatus()).isEqualTo(CatalogLookup.Status.UPSTREAM_ERROR);
    }

    @Test
    void search_emptyResultsAreNotFound() {
        catalog.onSearch("nothing", HttpStatus.OK, "{\"results\":[]}");

        CatalogSearchResult result = client.search("nothing", null, null).block();

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.toLookup().getStatus()).isEqualTo(CatalogLookup.Status.NOT_FOUND);
    }

    @Test
    void search_sendsEncryptedIdentityWhenAddressGiven() {
        catalog.onSearch("fastapi", HttpStatus.OK, SEARCH_JSON);

        client.search("fastapi", "192.0.2.10", null).block();

        assertThat(catalog.lastRequest().headers().getFirst(IdentityHeaderBuilder.CLIENT_IP_HEADER))
            .matches("[0-9a-f]{32}:[0-9a-f]{32}");
        assertThat(catalog.lastRequest().headers().containsKey(HttpHeaders.AUTHORIZATION)).isFalse();
    }

    @Test
    void fetchDocs_returnsTextWithFixedParametersAndSourceHeader() {
        catalog.onDocs("tiangolo/fastapi", HttpStatus.OK, "FastAPI routing docs");

        CatalogLookup<String> lookup = client.fetchDocs(
            new DocumentationRequest("/tiangolo/fastapi", 5000, "routing"), null, "key-1").block();

        assertThat(lookup.isFound()).isTrue();
        assertThat(lookup.getValue()).isEqualTo("FastAPI routing docs");

        ClientRequest request = catalog.lastRequest();
        assertThat(request.url().getPath()).isEqualTo("/api/v1/tiangolo/fastapi");
        assertThat(StubCatalogExchange.queryParam(request, "tokens")).isEqualTo("5000");
        assertThat(StubCatalogExchange.queryParam(request, "topic")).isEqualTo("routing");
        assertThat(StubCatalogExchange.queryParam(request, "type")).isEqualTo("txt");
        assertThat(request.headers().getFirst(CatalogClient.SOURCE_HEADER)).isEqualTo("mcp-server");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer key-1");
    }

    @Test
    void fetchDocs_clampsTokenBudgetToMinimum() {
        catalog.onDocs("tiangolo/fastapi", HttpStatus.OK, "docs");

        client.fetchDocs(new DocumentationRequest("tiangolo/fastapi", 10, ""), null, null).block();

        assertThat(StubCatalogExchange.queryParam(catalog.lastRequest(), "tokens")).isEqualTo("1000");
    }

    @Test
    void fetchDocs_leadingSlashDoesNotChangeRequestPath() {
        catalog.onDocs("tiangolo/fastapi", HttpStatus.OK, "docs");

        client.fetchDocs(new DocumentationRequest("/tiangolo/fastapi", 2000, "x"), null, null).block();
        client.fetchDocs(new DocumentationRequest("tiangolo/fastapi", 2000, "x"), null, null).block();

        assertThat(catalog.requests()).hasSize(2);
        assertThat(catalog.requests().get(0).url()).isEqualTo(catalog.requests().get(1).url());
    }

    @Test
    void fetchDocs_encodesTopic() {
        catalog.onDocs("tiangolo/fastapi", HttpStatus.OK, "docs");

        client.fetchDocs(new DocumentationRequest("/tiangolo/fastapi", 2000, "dependency injection"), null, null).block();

        assertThat(catalog.lastRequest().url().getRawQuery()).contains("topic=dependency%20injection");
        assertThat(StubCatalogExchange.queryParam(catalog.lastRequest(), "topic")).isEqualTo("dependency injection");
    }

    @Test
    void fetchDocs_encodesPlusInTopic() {
        catalog.onDocs("isocpp/cppreference", HttpStatus.OK, "docs");

        client.fetchDocs(new DocumentationRequest("/isocpp/cppreference", 2000, "c++ templates"), null, null).block();

        assertThat(catalog.lastRequest().url().getRawQuery()).contains("topic=c%2B%2B%20templates");
        assertThat(StubCatalogExchange.queryParam(catalog.lastRequest(), "topic")).isEqualTo("c++ templates");
    }

    @Test
    void fetchDocs_sentinelBodiesAreNotFound() {
        catalog.onDocs("a/one", HttpStatus.OK, "No content available");
        catalog.onDocs("b/two", HttpStatus.OK, "No context data available");

        CatalogLookup<String> first = client.fetchDocs(new DocumentationRequest("/a/one", 2000, ""), null, null).block();
        CatalogLookup<String> second = client.fetchDocs(new DocumentationRequest("/b/two", 2000, ""), null, null).block();

        assertThat(first.getStatus()).isEqualTo(CatalogLookup.Status.NOT_FOUND);
        assertThat(first.getValue()).isNull();
        assertThat(second.getStatus()).isEqualTo(CatalogLookup.Status.NOT_FOUND);
    }

    @Test
    void fetchDocs_nonSuccessStatusIsUpstreamError() {
        catalog.onDocs("a/one", HttpStatus.INTERNAL_SERVER_ERROR, "boom");

        CatalogLookup<String> lookup = client.fetchDocs(new DocumentationRequest("/a/one", 2000, ""), null, null).block();

        assertThat(lookup.getStatus()).isEqualTo(CatalogLookup.Status.UPSTREAM_ERROR);
        assertThat(lookup.getDetail()).contains("500");
    }

    @Test
    void fetchDocs_unknownLibraryIsUpstreamError() {
        CatalogLookup<String> lookup = client.fetchDocs(new DocumentationRequest("/missing/lib", 2000, ""), null, null).block();

        assertThat(lookup.getStatus()).isEqualTo(CatalogLookup.Status.UPSTREAM_ERROR);
    }

    @Test
    void nothingIsSentUntilSubscribed() {
        catalog.onDocs("a/one", HttpStatus.OK, "docs");

        client.fetchDocs(new DocumentationRequest("/a/one", 2000, ""), null, null);
        client.search("fastapi", null, null);

        assertThat(catalog.callCount()).isZero();
    }
}
