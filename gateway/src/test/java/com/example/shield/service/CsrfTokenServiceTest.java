package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import com.example.shield.dto.CsrfVerification;
import com.example.shield.dto.RequestContext;
import com.example.shield.support.MutableClock;
import com.example.shield.util.SignatureCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CsrfTokenServiceTest {

    private MutableClock clock;
    private CsrfTokenService tokenService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        ShieldProperties properties = new ShieldProperties();
        tokenService = new CsrfTokenService(properties, new SignatureCodec("test-secret"), clock);
    }

    static RequestContext request(HttpMethod method, String path, String headerToken, String cookieToken) {
        HttpHeaders headers = new HttpHeaders();
        if (headerToken != null) {
            headers.set("x-csrf-token", headerToken);
        }
        return RequestContext.builder()
                .requestId("req-1")
                .method(method)
                .path(path)
                .headers(headers)
                .cookies(cookieToken != null ? Map.of("_csrf", cookieToken) : Map.of())
                .build();
    }

    @Test
    void testGeneratedTokenValidates() {
        String token = tokenService.generateToken();

        assertThat(token.split(":")).hasSize(3);
        assertThat(token.split(":")[0]).hasSize(64).matches("[0-9a-f]+");
        assertThat(token.split(":")[1]).isEqualTo(String.valueOf(clock.millis()));
        assertThat(tokenService.validateToken(token)).isTrue();
    }

    @Test
    void testIsExpiredReadsTimestampOnly() {
        String token = tokenService.generateToken();
        String[] parts = token.split(":");
        String resigned = parts[0] + ":" + parts[1] + ":not-a-signature";

        assertThat(tokenService.isExpired(token)).isFalse();
        assertThat(tokenService.isExpired(resigned)).isFalse();
        assertThat(tokenService.isExpired("garbage")).isTrue();
        assertThat(tokenService.isExpired(null)).isTrue();

        clock.advance(Duration.ofHours(24).plusMillis(1));
        assertThat(tokenService.isExpired(token)).isTrue();
    }

    @Test
    void testTokensAreDistinct() {
        assertThat(tokenService.generateToken()).isNotEqualTo(tokenService.generateToken());
    }

    @Test
    void testTokenExpiresAfterMaxAge() {
        String token = tokenService.generateToken();

        clock.advance(Duration.ofHours(24));
        assertThat(tokenService.validateToken(token)).isTrue();

        clock.advance(Duration.ofMillis(1));
        assertThat(tokenService.validateToken(token)).isFalse();
    }

    @Test
    void testTamperedSignatureRejected() {
        String token = tokenService.generateToken();
        char last = token.charAt(token.length() - 1);
        String tampered = token.substring(0, token.length() - 1) + (last == '0' ? '1' : '0');

        assertThat(tokenService.validateToken(tampered)).isFalse();
    }

    @Test
    void testTamperedTimestampRejected() {
        String[] parts = tokenService.generateToken().split(":");
        String tampered = parts[0] + ":" + (Long.parseLong(parts[1]) + 1000) + ":" + parts[2];

        assertThat(tokenService.validateToken(tampered)).isFalse();
    }

    @Test
    void testTokenFromOtherSecretRejected() {
        CsrfTokenService other = new CsrfTokenService(new ShieldProperties(), new SignatureCodec("other"), clock);

        assertThat(tokenService.validateToken(other.generateToken())).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "abc", "a:b", "a:notanumber:c", "a:1:b:c", ":123:abc", "abc:123:"})
    void testMalformedTokensRejected(String token) {
        assertThat(tokenService.validateToken(token)).isFalse();
    }

    @Test
    void testSafeMethodsNeedNoToken() {
        for (HttpMethod method : new HttpMethod[]{HttpMethod.GET, HttpMethod.HEAD, HttpMethod.OPTIONS, HttpMethod.TRACE}) {
            assertThat(tokenService.verifyRequest(request(method, "/api/articles", null, null)).valid()).isTrue();
        }
    }

    @Test
    void testUnsafeMethodWithoutTokenRejected() {
        CsrfVerification result = tokenService.verifyRequest(request(HttpMethod.POST, "/api/articles", null, null));

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).isEqualTo("CSRF token missing");
    }

    @Test
    void testInvalidTokenRejected() {
        CsrfVerification result = tokenService.verifyRequest(
                request(HttpMethod.DELETE, "/api/articles/1", "forged:1:abc", null));

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).isEqualTo("CSRF token invalid or expired");
    }

    @Test
    void testTokenAcceptedFromHeaderOrCookie() {
        String token = tokenService.generateToken();

        assertThat(tokenService.verifyRequest(request(HttpMethod.POST, "/api/articles", token, null)).valid()).isTrue();
        assertThat(tokenService.verifyRequest(request(HttpMethod.PUT, "/api/articles/1", null, token)).valid()).isTrue();
    }

    @Test
    void testHeaderTakesPrecedenceOverCookie() {
        String token = tokenService.generateToken();

        RequestContext request = request(HttpMethod.POST, "/api/articles", "forged:1:abc", token);

        assertThat(tokenService.extractToken(request)).isEqualTo("forged:1:abc");
        assertThat(tokenService.verifyRequest(request).valid()).isFalse();
    }

    @Test
    void testExemptPathsSkipVerification() {
        assertThat(tokenService.verifyRequest(request(HttpMethod.POST, "/api/webhooks/stripe", null, null)).valid())
                .isTrue();
        assertThat(tokenService.verifyRequest(request(HttpMethod.POST, "/api/auth/callback/github", null, null)).valid())
                .isTrue();
        assertThat(tokenService.verifyRequest(request(HttpMethod.POST, "/api/auth/signin", null, null)).valid())
                .isFalse();
    }
}
