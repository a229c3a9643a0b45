package com.example.shield.store;

import com.example.shield.dto.RateLimitStats;
import com.example.shield.model.RateWindow;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local window store. {@link ConcurrentHashMap#compute} locks only the
 * bin holding the key, so identifiers never contend on a global lock.
 */
@Slf4j
public class InMemoryRateWindowStore implements RateWindowStore {

    private final Map<WindowKey, RateWindow> windows = new ConcurrentHashMap<>();

    @Override
    public Mono<RateWindow> hit(String tier, String identifier, long windowMs, long nowMillis) {
        return Mono.fromSupplier(() -> windows.compute(new WindowKey(tier, identifier), (key, current) -> {
            RateWindow window = (current == null || current.isExpired(nowMillis))
                    ? RateWindow.open(nowMillis, windowMs)
                    : current;
            return window.increment();
        }));
    }

    @Override
    public Mono<Void> delete(String tier, String identifier) {
        return Mono.fromRunnable(() -> windows.remove(new WindowKey(tier, identifier)));
    }

    @Override
    public Mono<Long> sweepExpired(long nowMillis, int batchSize) {
        return Mono.fromSupplier(() -> {
            long removed = 0;
            Iterator<Map.Entry<WindowKey, RateWindow>> it = windows.entrySet().iterator();
            while (it.hasNext() && removed < batchSize) {
                Map.Entry<WindowKey, RateWindow> entry = it.next();
                // remove(key, value) so a window refreshed concurrently survives
                if (entry.getValue().isExpired(nowMillis) && windows.remove(entry.getKey(), entry.getValue())) {
                    removed++;
                }
            }
            if (removed > 0) {
                log.debug("Swept {} expired rate windows, {} remain", removed, windows.size());
            }
            return removed;
        });
    }

    @Override
    public Mono<RateLimitStats> stats(long nowMillis) {
        return Mono.fromSupplier(() -> {
            long active = 0;
            long expired = 0;
            for (RateWindow window : windows.values()) {
                if (window.isExpired(nowMillis)) {
                    expired++;
                } else {
                    active++;
                }
            }
            return new RateLimitStats(active + expired, active, expired);
        });
    }

    private record WindowKey(String tier, String identifier) {
    }
}
