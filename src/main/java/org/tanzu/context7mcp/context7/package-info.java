/**
 * Context7 catalog integration for the MCP server.
 *
 * <p>This package contains:
 * <ul>
 *   <li>{@link org.tanzu.context7mcp.context7.IdentityHeaderBuilder} – encrypted caller identity and outbound headers.</li>
 *   <li>{@link org.tanzu.context7mcp.context7.CatalogClient} – search and documentation fetch against the catalog REST API.</li>
 *   <li>{@link org.tanzu.context7mcp.context7.ResultFormatter} – search hits to human-readable text.</li>
 *   <li>{@link org.tanzu.context7mcp.context7.FanOutCoordinator} – concurrent, order-preserving multi-library lookups.</li>
 *   <li>{@link org.tanzu.context7mcp.context7.Context7Service} – MCP tool implementations.</li>
 * </ul>
 *
 * <p>Missing libraries and documentation travel as {@link org.tanzu.context7mcp.context7.CatalogLookup}
 * values until a tool decides whether they are errors.
 */
package org.tanzu.context7mcp.context7;
