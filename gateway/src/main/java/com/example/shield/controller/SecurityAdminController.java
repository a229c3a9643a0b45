package com.example.shield.controller;

import com.example.shield.dto.AdminMetricsView;
import com.example.shield.dto.AlertResolution;
import com.example.shield.dto.SecurityEventReport;
import com.example.shield.exception.ShieldException;
import com.example.shield.model.ErrorKind;
import com.example.shield.model.SecurityAlert;
import com.example.shield.model.SecurityEvent;
import com.example.shield.service.AnalyticsService;
import com.example.shield.service.ConfigurationService;
import com.example.shield.service.ErrorResponseBuilder;
import com.example.shield.service.RateLimiterService;
import com.example.shield.service.SecurityMonitorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Operator surface, reachable only on the admin port.
 */
@RestController
@RequestMapping("/shield/api/admin")
@RequiredArgsConstructor
@Slf4j
public class SecurityAdminController {

    private static final int MAX_ALERT_LIMIT = 1000;

    private final SecurityMonitorService monitor;
    private final RateLimiterService rateLimiter;
    private final ConfigurationService configService;
    private final AnalyticsService analyticsService;
    private final ErrorResponseBuilder errorResponseBuilder;

    @GetMapping("/alerts")
    public Flux<SecurityAlert> getAlerts(@RequestParam(defaultValue = "50") int limit,
                                         @RequestParam(defaultValue = "false") boolean openOnly) {
        if (limit < 1 || limit > MAX_ALERT_LIMIT) {
            return Flux.error(new ShieldException(ErrorKind.VALIDATION, "limit must be between 1 and 1000"));
        }
        return Flux.fromIterable(monitor.getAlerts(limit, openOnly));
    }

    @PostMapping("/alerts/{id}/resolve")
    public Mono<Map<String, Object>> resolveAlert(@PathVariable String id,
                                                  @RequestBody AlertResolution resolution) {
        return Mono.fromCallable(() -> {
            String resolvedBy = resolution.getResolvedBy();
            if (resolvedBy == null || resolvedBy.isBlank()) {
                throw new ShieldException(ErrorKind.VALIDATION, "resolvedBy is required");
            }
            if (!monitor.resolveAlert(id, resolvedBy)) {
                throw new ShieldException(ErrorKind.VALIDATION, "Alert not found or already resolved");
            }
            return Map.of("id", id, "resolved", true, "resolvedBy", resolvedBy);
        });
    }

    @GetMapping("/metrics")
    public Mono<AdminMetricsView> getMetrics() {
        return rateLimiter.stats()
                .map(rateLimits -> new AdminMetricsView(
                        monitor.getMetrics(),
                        analyticsService.getSummary(),
                        errorResponseBuilder.getErrorStats(),
                        rateLimits));
    }

    @PostMapping("/rate-limits/reset")
    public Mono<Map<String, Object>> resetRateLimit(@RequestBody Map<String, String> payload) {
        String identifier = payload.get("identifier");
        if (identifier == null || identifier.isBlank()) {
            return Mono.error(new ShieldException(ErrorKind.VALIDATION, "identifier is required"));
        }
        return rateLimiter.reset(identifier)
                .thenReturn(Map.of("identifier", identifier, "reset", true));
    }

    @GetMapping("/config")
    public Mono<Map<String, String>> getConfig() {
        return Mono.fromSupplier(configService::getAllConfigs);
    }

    @PutMapping("/config/{key}")
    public Mono<Map<String, String>> updateConfig(@PathVariable String key,
                                                  @RequestBody Map<String, String> payload) {
        return Mono.defer(() -> configService.updateConfig(key, payload.get("value")));
    }

    @PostMapping("/events")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<SecurityEvent> reportEvent(@RequestBody SecurityEventReport report) {
        return Mono.fromCallable(() -> {
            if (report.getType() == null) {
                throw new ShieldException(ErrorKind.VALIDATION, "type is required");
            }
            SecurityEvent.SecurityEventBuilder event = SecurityEvent.of(report.getType())
                    .sourceIp(report.getSourceIp())
                    .userAgent(report.getUserAgent())
                    .userId(report.getUserId());
            if (report.getSeverity() != null) {
                event.severity(report.getSeverity());
            }
            if (report.getDetails() != null) {
                event.details(report.getDetails());
            }
            return monitor.logEvent(event.build());
        });
    }
}
