package com.example.shield.model;

/**
 * Fixed-window counter. Windows are replaced, never decremented: once
 * {@code now >= resetAtMillis} the next hit opens a fresh window.
 */
public record RateWindow(int count, long resetAtMillis) {

    public static RateWindow open(long nowMillis, long windowMs) {
        return new RateWindow(0, nowMillis + windowMs);
    }

    public boolean isExpired(long nowMillis) {
        return nowMillis >= resetAtMillis;
    }

    public RateWindow increment() {
        return new RateWindow(count + 1, resetAtMillis);
    }
}
