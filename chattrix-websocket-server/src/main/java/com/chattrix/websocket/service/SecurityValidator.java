package com.chattrix.websocket.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;

/**
 * JWT validation for socket handshakes and REST calls.
 *
 * The token subject is the numeric user id.
 */
@Service
@Slf4j
public class SecurityValidator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final MetricsService metricsService;

    public SecurityValidator(
            @Value("${security.jwt.secret:default-secret-key-change-this-in-production-minimum-256-bits}") String secret,
            @Value("${security.jwt.expiration-ms:3600000}") long tokenExpirationMs,
            MetricsService metricsService) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.metricsService = metricsService;
    }

    /**
     * Resolves the user id carried by a token, with or without the Bearer prefix.
     */
    public Optional<Long> authenticate(String token) {
        if (token == null || token.isBlank()) {
            log.warn("Empty token provided");
            metricsService.recordAuthenticationAttempt(false);
            return Optional.empty();
        }

        String raw = token.startsWith(BEARER_PREFIX) ? token.substring(BEARER_PREFIX.length()) : token;

        try {
            Claims claims = extractAllClaims(raw.trim());
            Long userId = Long.valueOf(claims.getSubject());
            metricsService.recordAuthenticationAttempt(true);
            return Optional.of(userId);

        } catch (SignatureException e) {
            log.warn("Invalid JWT signature: {}", e.getMessage());
        } catch (MalformedJwtException e) {
            log.warn("Malformed JWT token: {}", e.getMessage());
        } catch (ExpiredJwtException e) {
            log.warn("Expired JWT token: {}", e.getMessage());
        } catch (UnsupportedJwtException e) {
            log.warn("Unsupported JWT token: {}", e.getMessage());
        } catch (NumberFormatException e) {
            log.warn("JWT subject is not a user id: {}", e.getMessage());
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected JWT token: {}", e.getMessage());
        }

        metricsService.recordAuthenticationAttempt(false);
        return Optional.empty();
    }

    /**
     * Extract all claims from token
     */
    private Claims extractAllClaims(String token) {
        return Jwts.parser()
            .verifyWith(secretKey)
            .build()
            .parseSignedClaims(token)
            .getPayload();
    }

    /**
     * Generate JWT token (for testing/development)
     */
    public String generateToken(Long userId) {
        return Jwts.builder()
            .subject(String.valueOf(userId))
            .issuedAt(new Date())
            .expiration(new Date(System.currentTimeMillis() + tokenExpirationMs))
            .signWith(secretKey)
            .compact();
    }
}
