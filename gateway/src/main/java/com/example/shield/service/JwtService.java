package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Attributes requests to a user by reading the {@code sub} claim of a bearer
 * token. Only tokens whose signature verifies against the configured secret
 * are trusted; without a secret attribution is skipped.
 */
@Service
@Slf4j
public class JwtService {

    private final SecretKey key;

    public JwtService(ShieldProperties properties) {
        this.key = buildKey(properties.getJwt().getSecret());
    }

    private static SecretKey buildKey(String secret) {
        if (secret == null || secret.isBlank()) {
            log.info("No JWT secret configured, user attribution disabled");
            return null;
        }
        try {
            return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        } catch (WeakKeyException e) {
            log.warn("JWT secret rejected, user attribution disabled: {}", e.getMessage());
            return null;
        }
    }

    public boolean isEnabled() {
        return key != null;
    }

    /**
     * @param authorization raw Authorization header value, with or without the {@code Bearer } prefix
     * @return the verified subject, or null when absent, unsigned, forged or expired
     */
    public String extractSubject(String authorization) {
        if (key == null || authorization == null || authorization.isBlank()) {
            return null;
        }
        String token = authorization;
        if (token.regionMatches(true, 0, "Bearer ", 0, 7)) {
            token = token.substring(7).trim();
        }
        try {
            return Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload()
                    .getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Ignoring unverifiable bearer token: {}", e.getMessage());
            return null;
        }
    }

    public static String extractAuthorizationHeader(HttpHeaders headers) {
        List<String> authHeaders = headers.get(HttpHeaders.AUTHORIZATION);
        if (authHeaders == null || authHeaders.isEmpty()) {
            return null;
        }
        return authHeaders.get(0);
    }
}
