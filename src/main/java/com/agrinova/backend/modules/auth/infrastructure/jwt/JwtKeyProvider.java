package com.agrinova.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Base64;
import java.util.EnumMap;
import java.util.Map;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.agrinova.backend.modules.auth.domain.TokenKind;

import io.jsonwebtoken.MalformedJwtException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC keys per token family. The JWS {@code kid} header names the family so a token can only be
 * verified with the key it was signed with.
 */
@Component
public class JwtKeyProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final Map<TokenKind, SecretKey> keys = new EnumMap<>(TokenKind.class);

    public JwtKeyProvider(
            @Value("${jwt.access-secret}") String accessSecret,
            @Value("${jwt.refresh-secret}") String refreshSecret,
            @Value("${jwt.offline-secret}") String offlineSecret
    ) {
        keys.put(TokenKind.ACCESS, toKey(accessSecret));
        keys.put(TokenKind.REFRESH, toKey(refreshSecret));
        keys.put(TokenKind.OFFLINE, toKey(offlineSecret));
    }

    public SecretKey signingKey(TokenKind kind) {
        return keys.get(kind);
    }

    public String keyId(TokenKind kind) {
        return kind.claimValue();
    }

    public Key verificationKey(String keyId) {
        TokenKind kind = TokenKind.fromClaim(keyId);
        if (kind == null) {
            throw new MalformedJwtException("Unknown key id");
        }
        return keys.get(kind);
    }

    private static SecretKey toKey(String secretString) {
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }
}
