package com.example.shield.config;

import com.example.shield.model.AlertCategory;
import com.example.shield.model.AlertRule;
import com.example.shield.model.CorrelationField;
import com.example.shield.model.CsrfMode;
import com.example.shield.model.RateLimitTier;
import com.example.shield.model.SecurityEventType;
import com.example.shield.model.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static configuration bound from the {@code shield.*} namespace. Defaults
 * here mirror {@code application.yml} so the components work without it.
 */
@Data
@ConfigurationProperties(prefix = "shield")
public class ShieldProperties {

    private RateLimit rateLimit = new RateLimit();
    private Csrf csrf = new Csrf();
    private Threat threat = new Threat();
    private Monitor monitor = new Monitor();
    private Pipeline pipeline = new Pipeline();
    private Jwt jwt = new Jwt();
    private Headers headers = new Headers();
    private Admin admin = new Admin();

    @Data
    public static class RateLimit {
        /** {@code memory} or {@code redis}. */
        private String store = "memory";
        private Duration storeTimeout = Duration.ofMillis(100);
        private List<RateLimitTier> tiers = new ArrayList<>(List.of(
                new RateLimitTier("auth", "/api/auth/**", 0, 15 * 60 * 1000L, 5),
                new RateLimitTier("upload", "/api/upload/**", 1, 60 * 1000L, 10),
                new RateLimitTier("search", "/api/search/**", 2, 60 * 1000L, 30),
                new RateLimitTier("admin", "/api/admin/**", 3, 60 * 1000L, 200),
                new RateLimitTier("general", "/api/**", 100, 60 * 1000L, 100)));
    }

    @Data
    public static class Csrf {
        private String secret = "default-csrf-secret-change-in-production";
        private int tokenLength = 32;
        private Duration maxAge = Duration.ofHours(24);
        private String cookieName = "_csrf";
        private String headerName = "x-csrf-token";
        private String sameSite = "Strict";
        private boolean secureCookie = false;
        private CsrfMode mode = CsrfMode.SIGNED;
        private String sessionCookieName = "SESSION";
        private int synchronizerCapacity = 10_000;
        private List<String> exemptPaths = new ArrayList<>(List.of(
                "/api/webhooks/**",
                "/api/auth/callback/**"));
    }

    @Data
    public static class Threat {
        /** Matches at or above this severity are rejected. */
        private Severity blockSeverity = Severity.HIGH;
        private int maxBodyBytes = 256 * 1024;
        private int maxFieldLength = 10_000;
    }

    @Data
    public static class Monitor {
        private int maxEvents = 10_000;
        private int maxAlerts = 1_000;
        private Duration retention = Duration.ofDays(7);
        private int sweepBatchSize = 500;
        private String webhookUrl;
        private Duration webhookTimeout = Duration.ofSeconds(2);
        private int webhookRetries = 2;
        private List<AlertRule> rules = new ArrayList<>(List.of(
                new AlertRule("failed-logins", SecurityEventType.LOGIN_FAILURE, CorrelationField.SOURCE_IP,
                        5, Duration.ofMinutes(15), AlertCategory.AUTHENTICATION, Severity.HIGH,
                        "Multiple Failed Login Attempts"),
                new AlertRule("suspicious-activity", SecurityEventType.SUSPICIOUS_ACTIVITY, CorrelationField.SOURCE_IP,
                        10, Duration.ofMinutes(60), AlertCategory.SUSPICIOUS_ACTIVITY, Severity.CRITICAL,
                        "Suspicious Activity Pattern Detected"),
                new AlertRule("admin-actions", SecurityEventType.ADMIN_ACTION, CorrelationField.USER_ID,
                        50, Duration.ofMinutes(60), AlertCategory.SECURITY_EVENT, Severity.MEDIUM,
                        "Excessive Admin Activity"),
                new AlertRule("file-uploads", SecurityEventType.FILE_UPLOAD, CorrelationField.SOURCE_IP,
                        100, Duration.ofMinutes(60), AlertCategory.FILE_UPLOAD, Severity.MEDIUM,
                        "Excessive File Upload Activity")));
    }

    @Data
    public static class Pipeline {
        private List<String> bypassPaths = new ArrayList<>(List.of("/api/health", "/api/metrics"));
        private Duration timeout = Duration.ofMillis(300);
        private boolean trustForwardedHeaders = true;
        private List<String> loginPaths = new ArrayList<>(List.of(
                "/api/auth/signin/**",
                "/api/auth/callback/credentials"));
    }

    @Data
    public static class Jwt {
        /** HMAC secret used to verify bearer tokens; attribution is off when blank. */
        private String secret;
    }

    @Data
    public static class Headers {
        private Map<String, String> values = new LinkedHashMap<>(Map.of(
                "Content-Security-Policy", "default-src 'self'; object-src 'none'; frame-ancestors 'none'; base-uri 'self'",
                "Strict-Transport-Security", "max-age=31536000; includeSubDomains; preload",
                "X-Frame-Options", "DENY",
                "X-Content-Type-Options", "nosniff",
                "Referrer-Policy", "origin-when-cross-origin",
                "Permissions-Policy", "camera=(), microphone=(), geolocation=()",
                "Cross-Origin-Opener-Policy", "same-origin",
                "Cross-Origin-Resource-Policy", "same-origin"));
    }

    @Data
    public static class Admin {
        private String host = "127.0.0.1";
        private int port = 9090;
        private String pathPrefix = "/shield/api/admin/";
    }
}
