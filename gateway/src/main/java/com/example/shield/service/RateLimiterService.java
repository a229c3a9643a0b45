package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import com.example.shield.dto.RateLimitResult;
import com.example.shield.dto.RateLimitStats;
import com.example.shield.model.RateLimitTier;
import com.example.shield.model.RateWindow;
import com.example.shield.model.SecurityEvent;
import com.example.shield.model.SecurityEventType;
import com.example.shield.store.RateWindowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.AntPathMatcher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-window rate limiting per {@code (identifier, tier)}. When the window
 * store fails or stalls the check fails open and a degraded-mode event is
 * recorded, at most once per second.
 */
@Service
@Slf4j
public class RateLimiterService {

    private static final long DEGRADED_EVENT_INTERVAL_MS = 1000;

    private final RateWindowStore store;
    private final SecurityMonitorService monitor;
    private final Clock clock;
    private final Duration storeTimeout;
    private final List<RateLimitTier> tiers;
    private final Map<String, RateLimitTier> tiersByName = new LinkedHashMap<>();
    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final AtomicLong lastDegradedEventAt = new AtomicLong(Long.MIN_VALUE);

    public RateLimiterService(RateWindowStore store,
                              SecurityMonitorService monitor,
                              ShieldProperties properties,
                              Clock clock) {
        this.store = store;
        this.monitor = monitor;
        this.clock = clock;
        this.storeTimeout = properties.getRateLimit().getStoreTimeout();
        // Sort by priority (lower number = evaluated first)
        this.tiers = properties.getRateLimit().getTiers().stream()
                .sorted(Comparator.comparingInt(RateLimitTier::getPriority))
                .toList();
        for (RateLimitTier tier : tiers) {
            if (tier.getMaxRequests() <= 0 || tier.getWindowMs() <= 0) {
                throw new IllegalArgumentException("Rate limit tier " + tier.getName()
                        + " needs a positive window and request limit");
            }
            tiersByName.put(tier.getName(), tier);
        }
        log.info("Loaded {} rate limit tiers: {}", tiers.size(), tiersByName.keySet());
    }

    /**
     * First tier, by priority, whose pattern matches the path. Paths outside
     * every pattern are not rate limited.
     */
    public Optional<RateLimitTier> resolveTier(String path) {
        return tiers.stream()
                .filter(tier -> pathMatcher.match(tier.getPathPattern(), path))
                .findFirst();
    }

    /**
     * Counts one request for {@code identifier} against {@code tierName}.
     *
     * @throws IllegalArgumentException when the tier is not configured
     */
    public Mono<RateLimitResult> check(String identifier, String tierName) {
        RateLimitTier tier = tiersByName.get(tierName);
        if (tier == null) {
            throw new IllegalArgumentException("Unknown rate limit tier: " + tierName);
        }
        long now = clock.millis();
        return Mono.defer(() -> store.hit(tier.getName(), identifier, tier.getWindowMs(), now))
                .timeout(storeTimeout)
                .map(window -> toResult(tier, window))
                .onErrorResume(error -> {
                    log.warn("Rate limit store unavailable, admitting {} on tier {}: {}",
                            identifier, tier.getName(), error.toString());
                    recordDegraded(identifier, tier, error);
                    return Mono.just(RateLimitResult.failOpen(tier.getName(), tier.getMaxRequests(), now));
                });
    }

    private RateLimitResult toResult(RateLimitTier tier, RateWindow window) {
        boolean allowed = window.count() <= tier.getMaxRequests();
        return RateLimitResult.builder()
                .allowed(allowed)
                .tier(tier.getName())
                .limit(tier.getMaxRequests())
                .remaining(allowed ? tier.getMaxRequests() - window.count() : 0)
                .resetAtMillis(window.resetAtMillis())
                .build();
    }

    private void recordDegraded(String identifier, RateLimitTier tier, Throwable error) {
        long now = clock.millis();
        long last = lastDegradedEventAt.get();
        if (last != Long.MIN_VALUE && now - last < DEGRADED_EVENT_INTERVAL_MS) {
            return;
        }
        if (!lastDegradedEventAt.compareAndSet(last, now)) {
            return;
        }
        monitor.logEvent(SecurityEvent.of(SecurityEventType.RATE_LIMITER_DEGRADED)
                .detail("tier", tier.getName())
                .detail("identifier", identifier)
                .detail("error", error.toString())
                .build());
    }

    /**
     * Clears the windows of {@code identifier} in every tier.
     */
    public Mono<Void> reset(String identifier) {
        return Flux.fromIterable(tiers)
                .flatMap(tier -> store.delete(tier.getName(), identifier))
                .then()
                .doOnSuccess(v -> log.info("Rate limit windows reset for {}", identifier));
    }

    public Mono<Void> reset(String identifier, String tierName) {
        if (!tiersByName.containsKey(tierName)) {
            return Mono.error(new IllegalArgumentException("Unknown rate limit tier: " + tierName));
        }
        return store.delete(tierName, identifier);
    }

    /**
     * Sweeps expired windows one batch at a time until a batch comes back
     * short.
     */
    public Mono<Long> sweepExpired(int batchSize) {
        long now = clock.millis();
        int batch = Math.max(1, batchSize);
        return store.sweepExpired(now, batch)
                .expand(removed -> removed >= batch ? store.sweepExpired(now, batch) : Mono.empty())
                .reduce(0L, Long::sum);
    }

    public Mono<RateLimitStats> stats() {
        return store.stats(clock.millis());
    }

    public List<RateLimitTier> getTiers() {
        return tiers;
    }
}
