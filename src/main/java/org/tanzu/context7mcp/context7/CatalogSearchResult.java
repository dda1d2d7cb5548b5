package org.tanzu.context7mcp.context7;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response of the catalog search endpoint.
 * 
 * A non-success upstream status is not raised; it is represented as an empty
 * result whose error carries the status code. Callers decide what an empty
 * result means.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CatalogSearchResult {

    private final List<CatalogSearchHit> results;
    private final String error;

    @JsonCreator
    public CatalogSearchResult(@JsonProperty("results") List<CatalogSearchHit> results,
                               @JsonProperty("error") String error) {
        this.results = results != null ? List.copyOf(results) : List.of();
        this.error = error;
    }

    public static CatalogSearchResult empty() {
        return new CatalogSearchResult(List.of(), null);
    }

    public static CatalogSearchResult upstreamError(int statusCode) {
        return new CatalogSearchResult(List.of(), String.valueOf(statusCode));
    }

    public List<CatalogSearchHit> getResults() { return results; }
    public String getError() { return error; }
    public boolean isEmpty() { return results.isEmpty(); }

    /**
     * Classifies this result for fan-out policies.
     * 
     * @return FOUND with this result if it has hits, UPSTREAM_ERROR if it is empty
     *         because of an upstream status, NOT_FOUND otherwise
     */
    public CatalogLookup<CatalogSearchResult> toLookup() {
        if (!results.isEmpty()) {
            return CatalogLookup.found(this);
        }
        if (error != null && !error.isEmpty()) {
            return CatalogLookup.upstreamError("Catalog search failed with status " + error);
        }
        return CatalogLookup.notFound("No matching libraries found.");
    }

    @Override
    public String toString() {
        return "CatalogSearchResult{results=" + results + ", error=" + error + "}";
    }
}
