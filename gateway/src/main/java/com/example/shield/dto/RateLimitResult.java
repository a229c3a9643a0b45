package com.example.shield.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitResult {
    private boolean allowed;
    private String tier;
    private int limit;
    private int remaining;
    private long resetAtMillis;
    private boolean degraded; // true when the store failed and the check failed open

    public long retryAfterSeconds(long nowMillis) {
        long millis = Math.max(0, resetAtMillis - nowMillis);
        return Math.max(1, (millis + 999) / 1000);
    }

    public static RateLimitResult failOpen(String tier, int limit, long nowMillis) {
        return new RateLimitResult(true, tier, limit, limit, nowMillis, true);
    }
}
