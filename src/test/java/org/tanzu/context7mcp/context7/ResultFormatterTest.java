package org.tanzu.context7mcp.context7;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultFormatterTest {

    private final ResultFormatter formatter = new ResultFormatter();

    @Test
    void format_writesOptionalFieldsOnlyWhenMeaningful() {
        CatalogSearchHit full = new CatalogSearchHit("FastAPI", "/tiangolo/fastapi", "Modern web framework",
            1200, 9, List.of("v0.110.0", "v0.111.0"));
        CatalogSearchHit bare = new CatalogSearchHit("Tiny", "/tiny/lib", "Small lib", 0, 0, List.of());

        String text = formatter.format(new CatalogSearchResult(List.of(full, bare), null));

        assertThat(text).isEqualTo(
            "- Title: FastAPI\n"
                + "- ID: /tiangolo/fastapi\n"
                + "- Description: Modern web framework\n"
                + "- Code Snippets: 1200\n"
                + "- Trust Score: 9\n"
                + "- Versions: v0.110.0, v0.111.0"
                + "\n----------\n"
                + "- Title: Tiny\n"
                + "- ID: /tiny/lib\n"
                + "- Description: Small lib");
    }

    @Test
    void format_missingFieldsBecomeEmpty() {
        CatalogSearchHit hit = new CatalogSearchHit(null, "/x/y", null, null, null, null);

        assertThat(formatter.format(new CatalogSearchResult(List.of(hit), null)))
            .isEqualTo("- Title: \n- ID: /x/y\n- Description: ");
    }

    @Test
    void format_emptyResultIsEmptyString() {
        assertThat(formatter.format(CatalogSearchResult.empty())).isEmpty();
        assertThat(formatter.format(CatalogSearchResult.upstreamError(500))).isEmpty();
    }

    @Test
    void format_boundFromCatalogJson() throws Exception {
        String json = "{\"results\":[{\"title\":\"SQLAlchemy\",\"id\":\"/sqlalchemy/sqlalchemy\","
            + "\"description\":\"ORM\",\"totalSnippets\":42,\"trustScore\":7.5,\"stars\":9000}]}";

        CatalogSearchResult result = new ObjectMapper().readValue(json, CatalogSearchResult.class);

        assertThat(formatter.format(result)).isEqualTo(
            "- Title: SQLAlchemy\n- ID: /sqlalchemy/sqlalchemy\n- Description: ORM\n- Code Snippets: 42\n- Trust Score: 7.5");
    }
}
