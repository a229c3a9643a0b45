package com.example.shield.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * An alert synthesized from correlated events. The only mutation after
 * creation is the one-way {@code open -> resolved} transition plus the
 * running count of correlated events while the alert is open.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SecurityAlert {
    private final String id;
    @JsonIgnore
    private final String correlationKey;
    private final String ruleName;
    private final AlertCategory category;
    private final Severity severity;
    private final String title;
    private final String description;
    private final Instant createdAt;
    private final String sourceIp;
    private final String userAgent;
    private final String userId;
    private final Map<String, Object> details;

    private volatile int eventCount;
    private volatile boolean resolved;
    private volatile Instant resolvedAt;
    private volatile String resolvedBy;

    public synchronized boolean resolve(String by, Instant at) {
        if (resolved) {
            return false;
        }
        resolvedBy = by;
        resolvedAt = at;
        resolved = true;
        return true;
    }

    public synchronized void recordOccurrences(int count) {
        if (!resolved && count > eventCount) {
            eventCount = count;
        }
    }
}
