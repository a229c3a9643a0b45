package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic cleanup of expired rate windows, aged-out events and alerts, and
 * expired synchronizer sessions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MaintenanceService {

    private final RateLimiterService rateLimiter;
    private final SecurityMonitorService monitor;
    private final SynchronizerTokenRegistry synchronizerRegistry;
    private final ShieldProperties properties;

    @Scheduled(fixedDelayString = "${shield.sweep-interval-ms:300000}",
            initialDelayString = "${shield.sweep-interval-ms:300000}")
    public void sweep() {
        int batchSize = properties.getMonitor().getSweepBatchSize();
        rateLimiter.sweepExpired(batchSize)
                .subscribe(
                        removed -> log.debug("Removed {} expired rate windows", removed),
                        error -> log.warn("Rate window sweep failed: {}", error.getMessage()));
        try {
            SecurityMonitorService.SweepReport report = monitor.sweep();
            int sessions = synchronizerRegistry.sweepExpired(batchSize);
            log.debug("Maintenance sweep: {} events, {} alerts, {} idle actors, {} sessions removed",
                    report.eventsRemoved(), report.alertsRemoved(), report.actorsForgotten(), sessions);
        } catch (RuntimeException e) {
            log.error("Maintenance sweep failed", e);
        }
    }
}
