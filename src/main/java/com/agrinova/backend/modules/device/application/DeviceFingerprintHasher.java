package com.agrinova.backend.modules.device.application;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Keyed hash of client-supplied device fingerprints. Raw fingerprints are never stored.
 */
@Component
public class DeviceFingerprintHasher {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKeySpec key;

    public DeviceFingerprintHasher(@Value("${agrinova.device.fingerprint-secret}") String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("agrinova.device.fingerprint-secret must be configured");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA_256);
    }

    public String hash(String fingerprint) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA_256);
            mac.init(key);
            byte[] digest = mac.doFinal(fingerprint.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", ex);
        }
    }

    /**
     * Constant-time comparison of a presented fingerprint against a stored hash.
     */
    public boolean matches(String fingerprint, String storedHash) {
        if (fingerprint == null || storedHash == null) {
            return false;
        }
        byte[] presented = hash(fingerprint).getBytes(StandardCharsets.US_ASCII);
        byte[] stored = storedHash.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(presented, stored);
    }
}
