package com.lyshra.open.flowsync.core.engine.hash;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 over the UTF-8 bytes of the payload, rendered as 64 hex characters.
 */
@Slf4j
public final class Sha256ContentDigester implements IContentDigester {

    private static final String HASH_ALGORITHM = "SHA-256";

    private static final Sha256ContentDigester INSTANCE = new Sha256ContentDigester();

    private Sha256ContentDigester() {
    }

    public static IContentDigester getInstance() {
        return INSTANCE;
    }

    @Override
    public String digest(String canonicalPayload) {
        if (canonicalPayload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] hashBytes = digest.digest(canonicalPayload.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            log.error("SHA-256 algorithm not available", e);
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
