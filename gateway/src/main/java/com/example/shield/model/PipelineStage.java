package com.example.shield.model;

public enum PipelineStage {
    ENTRY,
    BYPASS_CHECK,
    RATE_LIMIT,
    THREAT_SCAN,
    CSRF_CHECK,
    ADMITTED,
    REJECTED
}
