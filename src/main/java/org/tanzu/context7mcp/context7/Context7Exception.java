package org.tanzu.context7mcp.context7;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures surfaced to MCP clients.
 * 
 * Each failure carries the HTTP status that best describes it, so callers
 * (and logs) can tell a missing library apart from a bad request or an
 * internal error. The message is what the MCP client sees as tool error text
 * and must never contain internal details.
 */
public class Context7Exception extends RuntimeException {

    private final HttpStatus status;

    public Context7Exception(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public Context7Exception(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() { return status; }
}
