package com.example.shield.store;

import com.example.shield.model.SecurityAlert;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Alerts indexed by id, plus the open alert for each correlation key. At most
 * one alert per key is open at a time; a new one may open only after the
 * previous one is resolved.
 */
@Slf4j
public class SecurityAlertStore {

    private final Map<String, SecurityAlert> alertsById = new ConcurrentHashMap<>();
    private final Map<String, SecurityAlert> openByCorrelationKey = new ConcurrentHashMap<>();
    private final int capacity;

    public SecurityAlertStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Alert store capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Opens the alert built by {@code factory} unless one is already open for
     * {@code correlationKey}, in which case the open alert's count is updated.
     *
     * @return the newly opened alert, or empty when deduplicated
     */
    public Optional<SecurityAlert> openIfAbsent(String correlationKey, Supplier<SecurityAlert> factory, int eventCount) {
        SecurityAlert[] created = new SecurityAlert[1];
        SecurityAlert current = openByCorrelationKey.computeIfAbsent(correlationKey, key -> {
            created[0] = factory.get();
            return created[0];
        });
        if (created[0] == null) {
            current.recordOccurrences(eventCount);
            return Optional.empty();
        }
        alertsById.put(current.getId(), current);
        evictResolvedOverCapacity();
        return Optional.of(current);
    }

    public Optional<SecurityAlert> findById(String id) {
        return Optional.ofNullable(alertsById.get(id));
    }

    /**
     * @return false when the alert does not exist or was already resolved
     */
    public boolean resolve(String id, String resolvedBy, Instant at) {
        SecurityAlert alert = alertsById.get(id);
        if (alert == null || !alert.resolve(resolvedBy, at)) {
            return false;
        }
        openByCorrelationKey.remove(alert.getCorrelationKey(), alert);
        return true;
    }

    /** Newest first. */
    public List<SecurityAlert> list(int limit, boolean openOnly) {
        return alertsById.values().stream()
                .filter(alert -> !openOnly || !alert.isResolved())
                .sorted(Comparator.comparing(SecurityAlert::getCreatedAt).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    public long countCreatedSince(Instant since) {
        return alertsById.values().stream()
                .filter(alert -> !alert.getCreatedAt().isBefore(since))
                .count();
    }

    public long countOpen() {
        return openByCorrelationKey.size();
    }

    public int size() {
        return alertsById.size();
    }

    /**
     * Removes resolved alerts created before {@code cutoff}. Open alerts are
     * kept regardless of age.
     */
    public long removeResolvedOlderThan(Instant cutoff, int batchSize) {
        long removed = 0;
        for (SecurityAlert alert : alertsById.values()) {
            if (removed >= batchSize) {
                break;
            }
            if (alert.isResolved() && alert.getCreatedAt().isBefore(cutoff)
                    && alertsById.remove(alert.getId(), alert)) {
                removed++;
            }
        }
        return removed;
    }

    private void evictResolvedOverCapacity() {
        int excess = alertsById.size() - capacity;
        if (excess <= 0) {
            return;
        }
        List<SecurityAlert> resolved = alertsById.values().stream()
                .filter(SecurityAlert::isResolved)
                .sorted(Comparator.comparing(SecurityAlert::getCreatedAt))
                .limit(excess)
                .toList();
        resolved.forEach(alert -> alertsById.remove(alert.getId(), alert));
        if (resolved.size() < excess) {
            log.warn("Alert store over capacity ({}), {} open alerts cannot be evicted",
                    alertsById.size(), excess - resolved.size());
        }
    }
}
