package org.tanzu.context7mcp.context7;

import org.springframework.http.HttpStatus;

/**
 * Thrown when the configured client IP encryption key is missing, is not valid
 * hex, or does not decode to an AES key length.
 */
public class EncryptionConfigException extends Context7Exception {

    public EncryptionConfigException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public EncryptionConfigException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
