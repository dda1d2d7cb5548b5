package org.tanzu.context7mcp.context7;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.tanzu.context7mcp.config.Context7Config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Service class that provides MCP (Model Context Protocol) tools for Context7 documentation lookup.
 * 
 * The service provides the following MCP tools:
 * - get_default_prompt: the instructional prompt describing how to use the other tools
 * - resolve_library_id: search the catalog for one library name
 * - get_library_docs: fetch documentation for one library id
 * - resolve_multiple_library_ids: search for several names concurrently (all-or-nothing)
 * - get_multiple_library_docs: fetch documentation for several ids concurrently (best-effort)
 * 
 * Every tool is an error boundary: {@link Context7Exception}s pass through with
 * their user-facing message, anything else is logged and replaced by a generic
 * internal failure.
 */
@Service
public class Context7Service {

    private static final Logger logger = LoggerFactory.getLogger(Context7Service.class);

    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    private final CatalogClient catalogClient;
    private final FanOutCoordinator fanOutCoordinator;
    private final ResultFormatter resultFormatter;
    private final Context7Config context7Config;
    private final String defaultPrompt;

    public Context7Service(CatalogClient catalogClient,
                           FanOutCoordinator fanOutCoordinator,
                           ResultFormatter resultFormatter,
                           Context7Config context7Config,
                           @Value("classpath:prompts/default-prompt.md") Resource defaultPromptResource) {
        this.catalogClient = catalogClient;
        this.fanOutCoordinator = fanOutCoordinator;
        this.resultFormatter = resultFormatter;
        this.context7Config = context7Config;
        this.defaultPrompt = loadPrompt(defaultPromptResource);
        logger.info("Context7Service initialized with CatalogClient and FanOutCoordinator");
    }

    /**
     * MCP tool: Returns the default instructional prompt for the assistant.
     * 
     * @return the prompt describing the query-resolution workflow
     */
    @Tool(name = "get_default_prompt",
          description = "Provides the default instructional prompt used by the Context7 assistant. It describes the "
              + "overall query-resolution workflow, library matching strategies, multi-library handling, and general "
              + "guidelines the assistant should follow while answering software related questions.")
    public DefaultPromptResult getDefaultPrompt() {
        logger.info("=== MCP TOOL CALLED: get_default_prompt() ===");
        return new DefaultPromptResult(defaultPrompt);
    }

    /**
     * MCP tool: Resolves a library name to matching Context7 library IDs.
     * 
     * @param libraryName plain library name, e.g. "FastAPI"
     * @return formatted summary of the matching libraries
     * @throws LibraryNotFoundException if the catalog has no match
     */
    @Tool(name = "resolve_library_id",
          description = "Receives a single library name, queries Context7's search API for matching entries and "
              + "returns a human-readable summary. Each match contains the canonical Context7 library ID, title, "
              + "description, trust score and available versions.")
    public LibraryIdResult resolveLibraryId(
            @ToolParam(description = "Plain name or keyword of the library to search for, e.g. 'FastAPI' or 'SQLAlchemy'")
            String libraryName) {
        logger.info("=== MCP TOOL CALLED: resolve_library_id() ===");
        logger.debug("library_name={}", libraryName);
        try {
            CatalogSearchResult result = catalogClient.search(libraryName, callerAddress(), context7Config.getApiKey()).block();
            if (result == null || !result.toLookup().isFound()) {
                throw new LibraryNotFoundException();
            }
            return new LibraryIdResult(resultFormatter.format(result));
        } catch (Context7Exception e) {
            throw logged(e);
        } catch (Exception e) {
            throw internalFailure("resolve_library_id", e);
        }
    }

    /**
     * MCP tool: Fetches documentation for one library id.
     * 
     * @param libraryId Context7 library id, e.g. "/tiangolo/fastapi"
     * @param tokens maximum token budget; defaults to the configured budget, raised to the configured minimum
     * @param topic optional topic filter
     * @return the documentation text
     * @throws DocumentationNotFoundException if the catalog has no documentation
     */
    @Tool(name = "get_library_docs",
          description = "Given a valid Context7 library ID, retrieves sections of documentation text. Optionally "
              + "accepts a topic keyword to narrow retrieval and a maximum token budget to constrain the size of "
              + "the response.")
    public LibraryDocsResult getLibraryDocs(
            @ToolParam(description = "Canonical Context7 library ID, e.g. '/tiangolo/fastapi'")
            String libraryId,
            @ToolParam(description = "Maximum token budget for the returned content. Small values are raised to the server minimum.", required = false)
            Integer tokens,
            @ToolParam(description = "Topic keyword to narrow which documentation sections are returned", required = false)
            String topic) {
        logger.info("=== MCP TOOL CALLED: get_library_docs() ===");
        logger.debug("library_id={}, tokens={}, topic={}", libraryId, tokens, topic);
        try {
            DocumentationRequest request = new DocumentationRequest(
                libraryId, tokens != null ? tokens : context7Config.getDefaultTokens(), topic);
            CatalogLookup<String> lookup = catalogClient.fetchDocs(request, callerAddress(), context7Config.getApiKey()).block();
            if (lookup == null || !lookup.isFound()) {
                throw new DocumentationNotFoundException();
            }
            return new LibraryDocsResult(lookup.getValue());
        } catch (Context7Exception e) {
            throw logged(e);
        } catch (Exception e) {
            throw internalFailure("get_library_docs", e);
        }
    }

    /**
     * MCP tool: Resolves several library names concurrently.
     * 
     * @param libraryNames library names
     * @return formatted summaries aligned with the requested names
     * @throws LibraryNotFoundException if any name has no match
     */
    @Tool(name = "resolve_multiple_library_ids",
          description = "Queries multiple library names concurrently against Context7's API. Each name is resolved "
              + "independently and results are returned in a list aligned to the request order. Fails if any "
              + "name has no match.")
    public LibraryIdsResult resolveMultipleLibraryIds(
            @ToolParam(description = "List of plain library names to search for, e.g. ['fastAPI', 'SQLAlchemy']")
            List<String> libraryNames) {
        logger.info("=== MCP TOOL CALLED: resolve_multiple_library_ids() ===");
        logger.debug("library_names={}", libraryNames);
        try {
            List<String> results = fanOutCoordinator
                .resolveMany(libraryNames, callerAddress(), context7Config.getApiKey())
                .block();
            return new LibraryIdsResult(results);
        } catch (Context7Exception e) {
            throw logged(e);
        } catch (Exception e) {
            throw internalFailure("resolve_multiple_library_ids", e);
        }
    }

    /**
     * MCP tool: Fetches documentation for several libraries concurrently.
     * 
     * @param libraryIds library ids
     * @param tokens token budget per library
     * @param topics topic filter per library
     * @return documentation texts, or "not found" messages, aligned with the requested ids
     * @throws BatchValidationException if the three lists differ in length
     */
    @Tool(name = "get_multiple_library_docs",
          description = "Retrieves documentation for multiple libraries in parallel. Requires equal-length arrays of "
              + "library IDs, token budgets and topic filters. The result is a list aligned to the input order, with "
              + "fetched documentation or an explanatory message for libraries without documentation.")
    public LibraryDocsListResult getMultipleLibraryDocs(
            @ToolParam(description = "Context7 library IDs, e.g. ['/tiangolo/fastapi', '/sqlalchemy/sqlalchemy']. Index-aligned with tokens and topics.")
            List<String> libraryIds,
            @ToolParam(description = "Token budget per library ID, e.g. [2500, 25000]. Same length as libraryIds.")
            List<Integer> tokens,
            @ToolParam(description = "Topic filter per library ID. Same length as libraryIds.")
            List<String> topics) {
        logger.info("=== MCP TOOL CALLED: get_multiple_library_docs() ===");
        logger.debug("library_ids={}, tokens={}, topics={}", libraryIds, tokens, topics);
        try {
            List<String> results = fanOutCoordinator
                .fetchMany(libraryIds, tokens, topics, callerAddress(), context7Config.getApiKey())
                .block();
            return new LibraryDocsListResult(results);
        } catch (Context7Exception e) {
            throw logged(e);
        } catch (Exception e) {
            throw internalFailure("get_multiple_library_docs", e);
        }
    }

    /**
     * The MCP transport does not expose the remote address to tools, so requests
     * go out without an mcp-client-ip header.
     */
    private String callerAddress() {
        return null;
    }

    private static Context7Exception logged(Context7Exception e) {
        logger.error("[{}] {}", e.getClass().getSimpleName(), e.getMessage());
        return e;
    }

    private static Context7Exception internalFailure(String tool, Exception e) {
        logger.error("Unexpected failure in tool {}: {}", tool, e.getMessage(), e);
        return new Context7Exception(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_MESSAGE, e);
    }

    private static String loadPrompt(Resource resource) {
        try {
            return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default prompt from " + resource, e);
        }
    }

    /**
     * Result of the get_default_prompt tool.
     */
    public static class DefaultPromptResult {
        private final String defaultPrompt;

        public DefaultPromptResult(String defaultPrompt) {
            this.defaultPrompt = defaultPrompt;
        }

        @JsonProperty("default_prompt")
        public String getDefaultPrompt() { return defaultPrompt; }
    }

    /**
     * Result of the resolve_library_id tool: formatted list of matching libraries.
     */
    public static class LibraryIdResult {
        private final String libraryId;

        public LibraryIdResult(String libraryId) {
            this.libraryId = libraryId;
        }

        @JsonProperty("library_id")
        public String getLibraryId() { return libraryId; }

        @Override
        public String toString() {
            return "LibraryIdResult{libraryId='" + libraryId + "'}";
        }
    }

    /**
     * Result of the get_library_docs tool: raw documentation text.
     */
    public static class LibraryDocsResult {
        private final String libraryInfo;

        public LibraryDocsResult(String libraryInfo) {
            this.libraryInfo = libraryInfo;
        }

        @JsonProperty("library_info")
        public String getLibraryInfo() { return libraryInfo; }
    }

    /**
     * Result of the resolve_multiple_library_ids tool, one summary per requested name.
     */
    public static class LibraryIdsResult {
        private final List<String> libraryIds;

        public LibraryIdsResult(List<String> libraryIds) {
            this.libraryIds = libraryIds;
        }

        @JsonProperty("library_ids")
        public List<String> getLibraryIds() { return libraryIds; }
    }

    /**
     * Result of the get_multiple_library_docs tool, one entry per requested id.
     */
    public static class LibraryDocsListResult {
        private final List<String> libraryInfos;

        public LibraryDocsListResult(List<String> libraryInfos) {
            this.libraryInfos = libraryInfos;
        }

        @JsonProperty("library_infos")
        public List<String> getLibraryInfos() { return libraryInfos; }
    }
}
