/**
 * Configuration for the Context7 MCP server.
 *
 * <p>Provides catalog connection and retrieval settings ({@link org.tanzu.context7mcp.config.Context7Config}),
 * startup logging and Cloud Foundry VCAP_SERVICES fallback ({@link org.tanzu.context7mcp.config.Context7ConfigProcessor}),
 * and WebClient setup with per-call connections ({@link org.tanzu.context7mcp.config.WebClientConfig}).
 */
package org.tanzu.context7mcp.config;
