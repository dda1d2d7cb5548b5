package org.tanzu.context7mcp.context7;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a library search yields no hits, for a single name or for any
 * member of a multi-library batch.
 */
public class LibraryNotFoundException extends Context7Exception {

    public LibraryNotFoundException() {
        this("No matching libraries found.");
    }

    public LibraryNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
