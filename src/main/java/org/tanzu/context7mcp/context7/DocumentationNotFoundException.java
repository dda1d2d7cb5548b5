package org.tanzu.context7mcp.context7;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a single documentation fetch comes back empty.
 */
public class DocumentationNotFoundException extends Context7Exception {

    public DocumentationNotFoundException() {
        super(HttpStatus.NOT_FOUND, "Documentation not found.");
    }
}
