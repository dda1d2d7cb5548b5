package org.tanzu.context7mcp.context7;

/**
 * One documentation fetch: library id, token budget and topic filter.
 * 
 * The library id is kept exactly as requested (it appears in user-facing
 * messages); {@link #getNormalizedLibraryId()} gives the form that goes on the wire.
 */
public final class DocumentationRequest {

    private final String libraryId;
    private final int tokenBudget;
    private final String topic;

    public DocumentationRequest(String libraryId, int tokenBudget, String topic) {
        this.libraryId = libraryId;
        this.tokenBudget = tokenBudget;
        this.topic = topic != null ? topic : "";
    }

    public String getLibraryId() { return libraryId; }
    public int getTokenBudget() { return tokenBudget; }
    public String getTopic() { return topic; }

    /**
     * @return the library id with one leading "/" removed
     */
    public String getNormalizedLibraryId() {
        return libraryId.startsWith("/") ? libraryId.substring(1) : libraryId;
    }

    /**
     * @param minimumTokens configured lower bound
     * @return the token budget raised to at least {@code minimumTokens}
     */
    public int getEffectiveTokenBudget(int minimumTokens) {
        return Math.max(tokenBudget, minimumTokens);
    }

    @Override
    public String toString() {
        return "DocumentationRequest{libraryId='" + libraryId + "', tokenBudget=" + tokenBudget + ", topic='" + topic + "'}";
    }
}
