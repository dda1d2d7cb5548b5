package org.tanzu.context7mcp.context7;

import java.util.HexFormat;

/**
 * An AES-CBC encrypted caller address, as sent in the mcp-client-ip header.
 * 
 * Instances are created fresh for every outbound call and are never decrypted
 * by this server; the catalog holds the shared key.
 */
public final class EncryptedIdentity {

    private final byte[] initializationVector;
    private final byte[] cipherText;

    public EncryptedIdentity(byte[] initializationVector, byte[] cipherText) {
        this.initializationVector = initializationVector.clone();
        this.cipherText = cipherText.clone();
    }

    public byte[] getInitializationVector() { return initializationVector.clone(); }
    public byte[] getCipherText() { return cipherText.clone(); }

    /**
     * Renders the identity as {@code hex(iv):hex(cipherText)}.
     * 
     * @return the header value
     */
    public String toHeaderValue() {
        HexFormat hex = HexFormat.of();
        return hex.formatHex(initializationVector) + ":" + hex.formatHex(cipherText);
    }

    @Override
    public String toString() {
        return toHeaderValue();
    }
}
