package com.example.shield.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable record of something security-relevant that happened. The monitor
 * assigns {@code id} and {@code timestamp} when the event is logged.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SecurityEvent {
    String id;
    SecurityEventType type;
    Severity severity;
    String sourceIp;
    String userAgent;
    String userId;
    Instant timestamp;
    @Singular
    Map<String, Object> details;

    public static SecurityEventBuilder of(SecurityEventType type) {
        return builder().type(type).severity(type.getDefaultSeverity());
    }
}
