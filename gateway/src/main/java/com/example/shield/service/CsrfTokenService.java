package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import com.example.shield.dto.CsrfVerification;
import com.example.shield.dto.RequestContext;
import com.example.shield.util.SignatureCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.util.AntPathMatcher;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Set;

/**
 * Stateless signed tokens of the form {@code random:issuedAtMillis:signature},
 * where the signature is HMAC-SHA-256 over {@code random:issuedAtMillis}.
 */
@Service
@Slf4j
public class CsrfTokenService {

    static final String MISSING = "CSRF token missing";
    static final String INVALID = "CSRF token invalid or expired";

    private static final Set<HttpMethod> SAFE_METHODS =
            Set.of(HttpMethod.GET, HttpMethod.HEAD, HttpMethod.OPTIONS, HttpMethod.TRACE);

    private final ShieldProperties.Csrf config;
    private final SignatureCodec codec;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public CsrfTokenService(ShieldProperties properties, SignatureCodec csrfSignatureCodec, Clock clock) {
        this.config = properties.getCsrf();
        this.codec = csrfSignatureCodec;
        this.clock = clock;
    }

    public String generateToken() {
        byte[] random = new byte[config.getTokenLength()];
        secureRandom.nextBytes(random);
        String payload = HexFormat.of().formatHex(random) + ":" + clock.millis();
        return payload + ":" + codec.sign(payload);
    }

    /**
     * Structure, age and signature check. Tokens exactly {@code maxAge} old
     * are still accepted.
     */
    public boolean validateToken(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        String[] parts = token.split(":", -1);
        if (parts.length != 3 || parts[0].isEmpty() || parts[2].isEmpty()) {
            return false;
        }
        long issuedAt;
        try {
            issuedAt = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            return false;
        }
        if (clock.millis() - issuedAt > config.getMaxAge().toMillis()) {
            return false;
        }
        return codec.verify(parts[0] + ":" + parts[1], parts[2]);
    }

    /**
     * Age check on the timestamp segment alone, for tokens this service
     * issued itself. Malformed tokens count as expired.
     */
    public boolean isExpired(String token) {
        String[] parts = token == null ? new String[0] : token.split(":", -1);
        if (parts.length != 3) {
            return true;
        }
        try {
            return clock.millis() - Long.parseLong(parts[1]) > config.getMaxAge().toMillis();
        } catch (NumberFormatException e) {
            return true;
        }
    }

    /** Header first, then cookie. */
    public String extractToken(RequestContext request) {
        String header = request.header(config.getHeaderName());
        if (header != null && !header.isBlank()) {
            return header;
        }
        String cookie = request.cookie(config.getCookieName());
        return cookie != null && !cookie.isBlank() ? cookie : null;
    }

    public boolean isSafeMethod(HttpMethod method) {
        return method == null || SAFE_METHODS.contains(method);
    }

    public boolean isExempt(String path) {
        return config.getExemptPaths().stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }

    public boolean requiresProtection(RequestContext request) {
        return !isSafeMethod(request.getMethod()) && !isExempt(request.getPath());
    }

    public CsrfVerification verifyRequest(RequestContext request) {
        if (!requiresProtection(request)) {
            return CsrfVerification.ok();
        }
        String token = extractToken(request);
        if (token == null) {
            return CsrfVerification.rejected(MISSING);
        }
        if (!validateToken(token)) {
            return CsrfVerification.rejected(INVALID);
        }
        return CsrfVerification.ok();
    }

    public ShieldProperties.Csrf getConfig() {
        return config;
    }
}
