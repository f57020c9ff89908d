package com.yamdb.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HS256 signing key built from {@code jwt.secret} ({@code JWT_SECRET}). A {@code base64:} prefix marks an
 * encoded key; any other value is taken as UTF-8 text. Keys under 256 bits fail startup.
 */
@Component
public class JwtTokenProvider {

    static final String BASE64_PREFIX = "base64:";
    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException("jwt.secret (JWT_SECRET) must be configured");
        }
        byte[] keyBytes = keyBytes(secretString.trim());
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret (JWT_SECRET) must be at least " + MIN_KEY_BYTES + " bytes for HS256");
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    private static byte[] keyBytes(String secret) {
        if (!secret.startsWith(BASE64_PREFIX)) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return Decoders.BASE64.decode(secret.substring(BASE64_PREFIX.length()));
        } catch (DecodingException ex) {
            throw new IllegalStateException("jwt.secret has the base64: prefix but is not valid Base64", ex);
        }
    }
}
