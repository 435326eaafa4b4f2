package com.eainde.trace.attestation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * {@code "0x"} followed by the lowercase hex SHA-256 of the UTF-8 bytes.
 */
public class ContentHasher {

    public static final String PREFIX = "0x";

    public String hash(String canonicalJson) {
        return PREFIX + HexFormat.of().formatHex(sha256(canonicalJson));
    }

    static byte[] sha256(String text) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
