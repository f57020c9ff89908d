package com.yamdb.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.yamdb.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.yamdb.backend.modules.policy.domain.Role;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    static final String USERNAME_CLAIM = "username";
    static final String ROLE_CLAIM = "role";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:86400000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public IssuedToken issueAccessToken(UUID userId, String username, Role role) {
        if (role == null || !role.isAssignable()) {
            throw new IllegalArgumentException("Cannot issue a token for role " + role);
        }
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);

        SecretKey key = tokenProvider.getSecretKey();

        String accessToken = Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(USERNAME_CLAIM, username)
                .claim(ROLE_CLAIM, role.name())
                .signWith(key, SIG.HS256)
                .compact();

        return new IssuedToken(
                accessToken,
                accessTokenTtlMillis / 1000L,
                OffsetDateTime.ofInstant(now, clock.getZone()),
                OffsetDateTime.ofInstant(expiry, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            String roleClaim = claims.get(ROLE_CLAIM, String.class);
            if (subject == null || roleClaim == null || claims.getExpiration() == null) {
                throw new InvalidTokenException("Access token is missing required claims", null);
            }
            UUID userId = UUID.fromString(subject);
            String username = claims.get(USERNAME_CLAIM, String.class);
            Role role = Role.valueOf(roleClaim);
            if (!role.isAssignable()) {
                throw new InvalidTokenException("Access token carries a non-account role", null);
            }

            return new ParsedToken(
                    userId,
                    username,
                    role,
                    OffsetDateTime.ofInstant(claims.getExpiration().toInstant(), clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public record IssuedToken(String token, long expiresInSeconds, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public record ParsedToken(UUID userId, String username, Role role, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
