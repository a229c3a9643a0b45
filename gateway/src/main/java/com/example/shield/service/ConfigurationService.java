package com.example.shield.service;

import com.example.shield.exception.ShieldException;
import com.example.shield.model.ErrorKind;
import com.example.shield.store.RuntimeConfigStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime on/off switches for each defense. Reads are served from the local
 * cache; Redis only persists overrides so they survive a restart, and an
 * unreachable Redis leaves the in-memory values in charge.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConfigurationService {

    public static final String RATE_LIMIT_ENABLED = "rate-limit-enabled";
    public static final String THREAT_DETECTION_ENABLED = "threat-detection-enabled";
    public static final String CSRF_ENABLED = "csrf-enabled";
    public static final String SECURITY_LOGGING_ENABLED = "security-logging-enabled";
    public static final String SECURITY_HEADERS_ENABLED = "security-headers-enabled";

    private static final Map<String, String> DEFAULT_CONFIGS = Map.of(
            RATE_LIMIT_ENABLED, "true",
            THREAT_DETECTION_ENABLED, "true",
            CSRF_ENABLED, "true",
            SECURITY_LOGGING_ENABLED, "true",
            SECURITY_HEADERS_ENABLED, "true");

    private final RuntimeConfigStore configStore;

    private final Cache<String, String> configCache = Caffeine.newBuilder()
            .maximumSize(64)
            .build();

    @PostConstruct
    public void init() {
        refreshCache().subscribe();
    }

    public Mono<Void> refreshCache() {
        return configStore.loadAll()
                .doOnNext(stored -> stored.forEach((key, value) -> {
                    if (DEFAULT_CONFIGS.containsKey(key)) {
                        configCache.put(key, value);
                    }
                }))
                .then()
                .onErrorResume(e -> {
                    log.warn("Could not load runtime configuration, using defaults: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    public String getConfig(String key, String defaultValue) {
        String value = configCache.getIfPresent(key);
        return value != null ? value : defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getConfig(key, String.valueOf(defaultValue));
        return Boolean.parseBoolean(value);
    }

    public boolean isEnabled(String key) {
        return getBoolean(key, Boolean.parseBoolean(DEFAULT_CONFIGS.getOrDefault(key, "false")));
    }

    public Map<String, String> getAllConfigs() {
        Map<String, String> all = new LinkedHashMap<>();
        DEFAULT_CONFIGS.keySet().stream().sorted()
                .forEach(key -> all.put(key, getConfig(key, DEFAULT_CONFIGS.get(key))));
        return all;
    }

    public Mono<Map<String, String>> updateConfig(String key, String value) {
        if (!DEFAULT_CONFIGS.containsKey(key)) {
            return Mono.error(new ShieldException(ErrorKind.VALIDATION, "Unknown configuration setting: " + key));
        }
        if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
            return Mono.error(new ShieldException(ErrorKind.VALIDATION, "Value must be true or false"));
        }
        String normalized = value.toLowerCase();
        configCache.put(key, normalized);
        log.info("Runtime setting {} changed to {}", key, normalized);
        return configStore.put(key, normalized)
                .onErrorResume(e -> {
                    log.warn("Runtime setting {} applied locally but not persisted: {}", key, e.getMessage());
                    return Mono.just(false);
                })
                .thenReturn(Map.of("key", key, "value", normalized));
    }
}
