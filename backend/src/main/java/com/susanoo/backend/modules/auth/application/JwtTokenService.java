package com.susanoo.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.susanoo.backend.modules.auth.domain.UserAccount;
import com.susanoo.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Stateless access tokens. Nothing is stored: a token stays valid until it expires, even after
 * its session is invalidated.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_SESSION_ID = "sid";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_TOKEN_TYPE = "typ";
    static final String ACCESS_TOKEN_TYPE = "access";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final String issuer;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.issuer:susanoo}") String issuer,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.issuer = issuer;
        this.clock = clock;
    }

    public IssuedAccessToken issueAccessToken(UserAccount user, UUID sessionId) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);

        String token = Jwts.builder()
                .issuer(issuer)
                .subject(user.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_TOKEN_TYPE, ACCESS_TOKEN_TYPE)
                .claim(CLAIM_SESSION_ID, sessionId.toString())
                .claim(CLAIM_ROLE, user.getRole().name())
                .claim(CLAIM_EMAIL, user.getEmail())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedAccessToken(
                token,
                OffsetDateTime.ofInstant(now, clock.getZone()),
                OffsetDateTime.ofInstant(expiry, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .requireIssuer(issuer)
                    .require(CLAIM_TOKEN_TYPE, ACCESS_TOKEN_TYPE)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (claims.getSubject() == null || claims.getExpiration() == null) {
                throw new InvalidTokenException("Access token lacks subject or expiry", null);
            }
            UUID userId = UUID.fromString(claims.getSubject());
            String rawSessionId = claims.get(CLAIM_SESSION_ID, String.class);
            UUID sessionId = rawSessionId != null ? UUID.fromString(rawSessionId) : null;
            Instant expiresAt = claims.getExpiration().toInstant();

            return new ParsedToken(
                    userId,
                    sessionId,
                    claims.get(CLAIM_EMAIL, String.class),
                    claims.get(CLAIM_ROLE, String.class),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record IssuedAccessToken(String token, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public record ParsedToken(UUID userId, UUID sessionId, String email, String role, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
