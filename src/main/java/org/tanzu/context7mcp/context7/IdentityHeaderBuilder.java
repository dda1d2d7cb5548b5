package org.tanzu.context7mcp.context7;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.context7mcp.config.Context7Config;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the headers sent with every Context7 catalog request.
 * 
 * The caller address, when known, is encrypted with AES in CBC mode using the
 * configured shared key and a random 16-byte IV, and sent as the mcp-client-ip
 * header. The API key, when configured, is sent as a bearer credential.
 */
@Component
public class IdentityHeaderBuilder {

    private static final Logger logger = LoggerFactory.getLogger(IdentityHeaderBuilder.class);

    public static final String CLIENT_IP_HEADER = "mcp-client-ip";
    public static final String AUTHORIZATION_HEADER = "Authorization";

    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final int IV_LENGTH = 16;

    private final Context7Config context7Config;
    private final SecureRandom secureRandom = new SecureRandom();

    public IdentityHeaderBuilder(Context7Config context7Config) {
        this.context7Config = context7Config;
    }

    /**
     * Encrypts a caller address with AES-CBC.
     * 
     * Java's PKCS5Padding is PKCS#7 padding for AES's 16-byte block. Two calls with
     * the same address and key return different cipher texts because each call
     * draws a new IV.
     * 
     * @param address the plain text IPv4/IPv6 address
     * @param keyHex hex-encoded AES key (16, 24 or 32 bytes)
     * @return the encrypted identity
     * @throws EncryptionConfigException if the key is missing or malformed
     */
    public EncryptedIdentity encryptIdentity(String address, String keyHex) {
        byte[] key = decodeKey(keyHex);
        byte[] iv = new byte[IV_LENGTH];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
            byte[] cipherText = cipher.doFinal(address.getBytes(StandardCharsets.UTF_8));
            return new EncryptedIdentity(iv, cipherText);
        } catch (GeneralSecurityException e) {
            throw new EncryptionConfigException("Failed to encrypt client address: " + e.getMessage(), e);
        }
    }

    /**
     * Assembles outbound headers.
     * 
     * @param address caller address to encrypt, or null
     * @param credential bearer credential, or null
     * @param extra headers copied into the result first, or null
     * @return a new mutable header map
     */
    public Map<String, String> buildHeaders(String address, String credential, Map<String, String> extra) {
        Map<String, String> headers = extra != null ? new LinkedHashMap<>(extra) : new LinkedHashMap<>();
        if (address != null && !address.isEmpty()) {
            headers.put(CLIENT_IP_HEADER,
                encryptIdentity(address, context7Config.getClientIpEncryptionKey()).toHeaderValue());
        }
        if (credential != null && !credential.isEmpty()) {
            headers.put(AUTHORIZATION_HEADER, "Bearer " + credential);
        }
        logger.debug("Built catalog request headers: {}", headers.keySet());
        return headers;
    }

    private static byte[] decodeKey(String keyHex) {
        if (keyHex == null || keyHex.isEmpty()) {
            throw new EncryptionConfigException("Client IP encryption key is not configured");
        }
        byte[] key;
        try {
            key = HexFormat.of().parseHex(keyHex);
        } catch (IllegalArgumentException e) {
            throw new EncryptionConfigException("Client IP encryption key is not valid hex", e);
        }
        if (key.length != 16 && key.length != 24 && key.length != 32) {
            throw new EncryptionConfigException(
                "Client IP encryption key must be 16, 24 or 32 bytes, got " + key.length);
        }
        return key;
    }
}
