package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.*;

class JwtServiceTest {

    private static final String SECRET = "jwt-service-test-secret-0123456789abcdef";

    private SecretKey key;
    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
        ShieldProperties properties = new ShieldProperties();
        properties.getJwt().setSecret(SECRET);
        jwtService = new JwtService(properties);
    }

    @Test
    void testExtractSubjectFromBearerHeader() {
        String token = Jwts.builder().subject("editor-1").signWith(key).compact();

        assertThat(jwtService.isEnabled()).isTrue();
        assertThat(jwtService.extractSubject("Bearer " + token)).isEqualTo("editor-1");
        assertThat(jwtService.extractSubject(token)).isEqualTo("editor-1");
    }

    @Test
    void testExpiredTokenIgnored() {
        String token = Jwts.builder()
                .subject("editor-1")
                .expiration(Date.from(Instant.now().minusSeconds(60)))
                .signWith(key)
                .compact();

        assertThat(jwtService.extractSubject("Bearer " + token)).isNull();
    }

    @Test
    void testUnsignedOrGarbageTokenIgnored() {
        String unsigned = Jwts.builder().subject("admin").compact();

        assertThat(jwtService.extractSubject("Bearer " + unsigned)).isNull();
        assertThat(jwtService.extractSubject("Bearer not.a.jwt")).isNull();
        assertThat(jwtService.extractSubject("")).isNull();
        assertThat(jwtService.extractSubject(null)).isNull();
    }

    @Test
    void testDisabledWithoutSecret() {
        JwtService disabled = new JwtService(new ShieldProperties());
        String token = Jwts.builder().subject("editor-1").signWith(key).compact();

        assertThat(disabled.isEnabled()).isFalse();
        assertThat(disabled.extractSubject("Bearer " + token)).isNull();
    }

    @Test
    void testWeakSecretDisablesAttribution() {
        ShieldProperties properties = new ShieldProperties();
        properties.getJwt().setSecret("short");

        assertThat(new JwtService(properties).isEnabled()).isFalse();
    }

    @Test
    void testExtractAuthorizationHeader() {
        HttpHeaders headers = new HttpHeaders();
        assertThat(JwtService.extractAuthorizationHeader(headers)).isNull();

        headers.add(HttpHeaders.AUTHORIZATION, "Bearer first");
        headers.add(HttpHeaders.AUTHORIZATION, "Bearer second");
        assertThat(JwtService.extractAuthorizationHeader(headers)).isEqualTo("Bearer first");
    }
}
