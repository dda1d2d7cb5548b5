package org.tanzu.context7mcp.context7;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One library entry returned by the catalog search endpoint.
 * 
 * Only title, id and description are always present. Snippet count, trust
 * score and versions are optional metadata.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CatalogSearchHit {

    private final String title;
    private final String id;
    private final String description;
    private final Integer totalSnippets;
    private final Number trustScore;
    private final List<String> versions;

    @JsonCreator
    public CatalogSearchHit(@JsonProperty("title") String title,
                            @JsonProperty("id") String id,
                            @JsonProperty("description") String description,
                            @JsonProperty("totalSnippets") Integer totalSnippets,
                            @JsonProperty("trustScore") Number trustScore,
                            @JsonProperty("versions") List<String> versions) {
        this.title = title;
        this.id = id;
        this.description = description;
        this.totalSnippets = totalSnippets;
        this.trustScore = trustScore;
        this.versions = versions != null ? List.copyOf(versions) : List.of();
    }

    public String getTitle() { return title; }
    public String getId() { return id; }
    public String getDescription() { return description; }
    public Integer getTotalSnippets() { return totalSnippets; }
    public Number getTrustScore() { return trustScore; }
    public List<String> getVersions() { return versions; }

    @Override
    public String toString() {
        return "CatalogSearchHit{id='" + id + "', title='" + title + "'}";
    }
}
