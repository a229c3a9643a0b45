package com.example.shield.dto;

public record RateLimitStats(long totalWindows, long activeWindows, long expiredWindows) {
}
