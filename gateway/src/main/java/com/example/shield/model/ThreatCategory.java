package com.example.shield.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Pattern classes recognised by the threat detector, with the severity a
 * match escalates a request to.
 */
public enum ThreatCategory {
    SQL_INJECTION(Severity.HIGH),
    XSS_ATTEMPT(Severity.HIGH),
    PROTOCOL_ABUSE(Severity.HIGH),
    PATH_TRAVERSAL(Severity.MEDIUM),
    ATTACK_PATH(Severity.MEDIUM),
    SUSPICIOUS_USER_AGENT(Severity.LOW),
    OVERSIZED_FIELD(Severity.LOW);

    private final Severity severity;

    ThreatCategory(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
