package org.tanzu.context7mcp.context7;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns catalog search hits into the text blocks returned by the resolve tools.
 */
@Component
public class ResultFormatter {

    static final String BLOCK_SEPARATOR = "\n----------\n";

    /**
     * Formats every hit of a search result.
     * 
     * Title, ID and description are always written. Code snippet count is added
     * only when positive, trust score only when present and non-zero, versions
     * only when there are any.
     * 
     * @param searchResult the catalog search result
     * @return one block per hit joined by a separator line; empty for no hits
     */
    public String format(CatalogSearchResult searchResult) {
        List<String> blocks = new ArrayList<>();
        for (CatalogSearchHit hit : searchResult.getResults()) {
            List<String> lines = new ArrayList<>();
            lines.add("- Title: " + nullToEmpty(hit.getTitle()));
            lines.add("- ID: " + nullToEmpty(hit.getId()));
            lines.add("- Description: " + nullToEmpty(hit.getDescription()));
            if (hit.getTotalSnippets() != null && hit.getTotalSnippets() > 0) {
                lines.add("- Code Snippets: " + hit.getTotalSnippets());
            }
            if (hit.getTrustScore() != null && hit.getTrustScore().doubleValue() != 0) {
                lines.add("- Trust Score: " + hit.getTrustScore());
            }
            if (!hit.getVersions().isEmpty()) {
                lines.add("- Versions: " + String.join(", ", hit.getVersions()));
            }
            blocks.add(String.join("\n", lines));
        }
        return String.join(BLOCK_SEPARATOR, blocks);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
