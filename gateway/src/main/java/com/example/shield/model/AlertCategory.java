package com.example.shield.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertCategory {
    SECURITY_EVENT,
    RATE_LIMIT,
    AUTHENTICATION,
    FILE_UPLOAD,
    SUSPICIOUS_ACTIVITY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
