package org.tanzu.context7mcp.context7;

import org.springframework.http.HttpStatus;

/**
 * Thrown before any catalog call is made when the aligned lists of a
 * multi-library documentation request differ in length.
 */
public class BatchValidationException extends Context7Exception {

    public BatchValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
