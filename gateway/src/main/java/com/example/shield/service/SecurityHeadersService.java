package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

/**
 * Adds the configured security headers to a response, leaving any header
 * the upstream already set untouched.
 */
@Service
@RequiredArgsConstructor
public class SecurityHeadersService {

    private final ShieldProperties properties;
    private final ConfigurationService configService;

    public void apply(HttpHeaders headers) {
        if (!configService.isEnabled(ConfigurationService.SECURITY_HEADERS_ENABLED)) {
            return;
        }
        properties.getHeaders().getValues().forEach((name, value) -> {
            if (!headers.containsKey(name)) {
                headers.set(name, value);
            }
        });
    }
}
