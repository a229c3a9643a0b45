package com.example.shield.service;

import com.example.shield.alert.AlertCorrelator;
import com.example.shield.alert.AlertDispatcher;
import com.example.shield.alert.CorrelationMatch;
import com.example.shield.config.ShieldProperties;
import com.example.shield.dto.SecurityMetrics;
import com.example.shield.model.CorrelationField;
import com.example.shield.model.SecurityAlert;
import com.example.shield.model.SecurityEvent;
import com.example.shield.model.SecurityEventType;
import com.example.shield.model.Severity;
import com.example.shield.store.SecurityAlertStore;
import com.example.shield.store.SecurityEventLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Records security events, correlates them into alerts and serves the
 * monitoring views. Every component that observes something security
 * relevant reports it here.
 */
@Service
@Slf4j
public class SecurityMonitorService {

    private static final Duration METRICS_WINDOW = Duration.ofHours(24);
    private static final int RECENT_EVENTS = 50;
    private static final int TOP_SOURCES = 10;
    private static final int ALERT_SAMPLE_EVENTS = 5;

    private final SecurityEventLog eventLog;
    private final SecurityAlertStore alertStore;
    private final AlertCorrelator correlator;
    private final AlertDispatcher dispatcher;
    private final Clock clock;
    private final Duration retention;
    private final int sweepBatchSize;

    public SecurityMonitorService(SecurityEventLog eventLog,
                                  SecurityAlertStore alertStore,
                                  AlertCorrelator correlator,
                                  AlertDispatcher dispatcher,
                                  ShieldProperties properties,
                                  Clock clock) {
        this.eventLog = eventLog;
        this.alertStore = alertStore;
        this.correlator = correlator;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.retention = properties.getMonitor().getRetention();
        this.sweepBatchSize = properties.getMonitor().getSweepBatchSize();
    }

    /**
     * Stamps, stores and correlates an event. A missing severity falls back to
     * the type's catalogue severity.
     *
     * @return the event as stored
     */
    public SecurityEvent logEvent(SecurityEvent event) {
        SecurityEvent stored = event.toBuilder()
                .id(UUID.randomUUID().toString())
                .timestamp(clock.instant())
                .severity(event.getSeverity() != null ? event.getSeverity() : event.getType().getDefaultSeverity())
                .build();
        eventLog.append(stored);
        logAtSeverity(stored);
        for (CorrelationMatch match : correlator.correlate(stored)) {
            openAlert(match);
        }
        return stored;
    }

    private void logAtSeverity(SecurityEvent event) {
        if (event.getSeverity().isAtLeast(Severity.HIGH)) {
            log.warn("Security event {} [{}] from {} user={} {}", event.getType().wireName(), event.getSeverity(),
                    event.getSourceIp(), event.getUserId(), event.getDetails());
        } else {
            log.info("Security event {} [{}] from {} user={}", event.getType().wireName(), event.getSeverity(),
                    event.getSourceIp(), event.getUserId());
        }
    }

    private void openAlert(CorrelationMatch match) {
        Optional<SecurityAlert> opened = alertStore.openIfAbsent(
                match.correlationKey(), () -> buildAlert(match), match.count());
        opened.ifPresent(alert -> dispatcher.dispatch(alert, (sink, error) -> logEvent(
                SecurityEvent.of(SecurityEventType.ALERT_DELIVERY_FAILED)
                        .detail("alertId", alert.getId())
                        .detail("sink", sink.name())
                        .detail("error", error.toString())
                        .build())));
    }

    private SecurityAlert buildAlert(CorrelationMatch match) {
        SecurityEvent trigger = match.trigger();
        CorrelationField groupBy = match.rule().getGroupBy();
        List<SecurityEvent> sample = eventLog.lastMatching(
                event -> event.getType() == trigger.getType() && match.actor().equals(groupBy.valueOf(event)),
                ALERT_SAMPLE_EVENTS);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("count", match.count());
        details.put("window", match.rule().getWindow().toString());
        details.put("recentEvents", sample);

        return SecurityAlert.builder()
                .id(UUID.randomUUID().toString())
                .correlationKey(match.correlationKey())
                .ruleName(match.rule().getName())
                .category(match.rule().getCategory())
                .severity(match.rule().getSeverity())
                .title(match.rule().getTitle())
                .description(String.format("%d %s events from %s %s within %s", match.count(),
                        trigger.getType().wireName(), groupBy == CorrelationField.USER_ID ? "user" : "IP",
                        match.actor(), humanize(match.rule().getWindow())))
                .createdAt(clock.instant())
                .sourceIp(trigger.getSourceIp())
                .userAgent(trigger.getUserAgent())
                .userId(trigger.getUserId())
                .details(details)
                .eventCount(match.count())
                .build();
    }

    public boolean resolveAlert(String alertId, String resolvedBy) {
        boolean resolved = alertStore.resolve(alertId, resolvedBy, clock.instant());
        if (resolved) {
            log.info("Security alert {} resolved by {}", alertId, resolvedBy);
        }
        return resolved;
    }

    public List<SecurityAlert> getAlerts(int limit, boolean openOnly) {
        return alertStore.list(limit, openOnly);
    }

    public SecurityMetrics getMetrics() {
        Instant since = clock.instant().minus(METRICS_WINDOW);
        List<SecurityEvent> events = eventLog.snapshot().stream()
                .filter(event -> !event.getTimestamp().isBefore(since))
                .toList();

        Map<String, Long> byType = events.stream()
                .collect(Collectors.groupingBy(event -> event.getType().wireName(), Collectors.counting()));
        Map<String, Long> bySeverity = events.stream()
                .collect(Collectors.groupingBy(event -> event.getSeverity().wireName(), Collectors.counting()));
        List<SecurityMetrics.SourceCount> topSources = events.stream()
                .map(SecurityEvent::getSourceIp)
                .filter(ip -> ip != null)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()))
                .entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_SOURCES)
                .map(entry -> new SecurityMetrics.SourceCount(entry.getKey(), entry.getValue()))
                .toList();
        List<SecurityEvent> recent = events.stream()
                .sorted(Comparator.comparing(SecurityEvent::getTimestamp).reversed())
                .limit(RECENT_EVENTS)
                .toList();

        return SecurityMetrics.builder()
                .totalEvents(events.size())
                .eventsByType(byType)
                .eventsBySeverity(bySeverity)
                .recentEvents(recent)
                .alertsGenerated(alertStore.countCreatedSince(since))
                .openAlerts(alertStore.countOpen())
                .topSourceIps(topSources)
                .suspiciousActivities(byType.getOrDefault(SecurityEventType.SUSPICIOUS_ACTIVITY.wireName(), 0L))
                .blockedRequests(byType.getOrDefault(SecurityEventType.RATE_LIMIT_EXCEEDED.wireName(), 0L))
                .build();
    }

    /**
     * Ages out events and resolved alerts past the retention horizon. Open
     * alerts stay until someone resolves them.
     */
    public SweepReport sweep() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(retention);
        long events = eventLog.removeOlderThan(cutoff, sweepBatchSize);
        long alerts = alertStore.removeResolvedOlderThan(cutoff, sweepBatchSize);
        int actors = correlator.sweep(now);
        if (events > 0 || alerts > 0) {
            log.info("Monitor sweep removed {} events and {} resolved alerts", events, alerts);
        }
        return new SweepReport(events, alerts, actors);
    }

    private static String humanize(Duration window) {
        if (window.toHours() > 0 && window.toMinutesPart() == 0) {
            return window.toHours() + (window.toHours() == 1 ? " hour" : " hours");
        }
        return window.toMinutes() + " minutes";
    }

    public record SweepReport(long eventsRemoved, long alertsRemoved, int actorsForgotten) {
    }
}
