package com.example.shield.store;

import com.example.shield.dto.RateLimitStats;
import com.example.shield.model.RateWindow;
import reactor.core.publisher.Mono;

/**
 * Backing storage for fixed-window counters keyed by {@code (tier, identifier)}.
 * Implementations must make {@link #hit} an atomic open-or-reuse plus
 * increment; callers never read and write a window separately.
 */
public interface RateWindowStore {

    /**
     * Counts one request against the window for {@code (tier, identifier)},
     * opening a fresh window when none exists or the stored one has expired.
     *
     * @return the window after the increment
     */
    Mono<RateWindow> hit(String tier, String identifier, long windowMs, long nowMillis);

    Mono<Void> delete(String tier, String identifier);

    /**
     * Removes at most {@code batchSize} expired windows.
     *
     * @return number of windows removed
     */
    Mono<Long> sweepExpired(long nowMillis, int batchSize);

    Mono<RateLimitStats> stats(long nowMillis);
}
