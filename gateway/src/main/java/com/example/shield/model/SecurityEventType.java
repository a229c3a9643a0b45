package com.example.shield.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of security events recorded by the monitor. The wire name is the
 * lower-case enum name (e.g. {@code login_failure}).
 */
public enum SecurityEventType {
    LOGIN_SUCCESS(Severity.LOW),
    LOGIN_FAILURE(Severity.MEDIUM),
    PASSWORD_CHANGE(Severity.MEDIUM),
    ACCOUNT_LOCKED(Severity.HIGH),
    SUSPICIOUS_ACTIVITY(Severity.HIGH),
    FILE_UPLOAD(Severity.LOW),
    ADMIN_ACTION(Severity.MEDIUM),
    DATA_EXPORT(Severity.HIGH),
    PERMISSION_CHANGE(Severity.HIGH),
    RATE_LIMIT_EXCEEDED(Severity.MEDIUM),
    CSRF_VALIDATION_FAILED(Severity.HIGH),
    INPUT_VALIDATION_FAILED(Severity.MEDIUM),
    RATE_LIMITER_DEGRADED(Severity.MEDIUM),
    ALERT_DELIVERY_FAILED(Severity.MEDIUM),
    PIPELINE_ERROR(Severity.MEDIUM);

    private final Severity defaultSeverity;

    SecurityEventType(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SecurityEventType fromWire(String value) {
        if (value == null) {
            return null;
        }
        return SecurityEventType.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
