package com.example.shield.store;

import com.example.shield.dto.RateLimitStats;
import com.example.shield.model.RateWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Window store on Redis for deployments that share counters. INCR and the
 * first-hit PEXPIRE run in one Lua script, so the increment-and-compare stays
 * atomic across processes; expired windows disappear through the key TTL.
 */
@RequiredArgsConstructor
@Slf4j
public class RedisRateWindowStore implements RateWindowStore {

    private static final String HIT_SCRIPT = """
            local count = redis.call('INCR', KEYS[1])
            if count == 1 then
              redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            local ttl = redis.call('PTTL', KEYS[1])
            if ttl < 0 then
              redis.call('PEXPIRE', KEYS[1], ARGV[1])
              ttl = tonumber(ARGV[1])
            end
            return count .. ':' .. ttl
            """;

    private static final RedisScript<String> HIT = RedisScript.of(HIT_SCRIPT, String.class);

    private final ReactiveStringRedisTemplate redisTemplate;

    @Override
    public Mono<RateWindow> hit(String tier, String identifier, long windowMs, long nowMillis) {
        String key = RedisKeys.rateWindowKey(tier, identifier);
        return redisTemplate.execute(HIT, List.of(key), List.of(String.valueOf(windowMs)))
                .next()
                .map(result -> toWindow(result, nowMillis));
    }

    @Override
    public Mono<Void> delete(String tier, String identifier) {
        return redisTemplate.delete(RedisKeys.rateWindowKey(tier, identifier)).then();
    }

    @Override
    public Mono<Long> sweepExpired(long nowMillis, int batchSize) {
        return Mono.just(0L);
    }

    @Override
    public Mono<RateLimitStats> stats(long nowMillis) {
        // key TTLs do the accounting server-side; nothing tracked locally
        return Mono.just(new RateLimitStats(0, 0, 0));
    }

    /** Parses the script's {@code count:ttlMillis} reply. */
    private RateWindow toWindow(String result, long nowMillis) {
        String[] parts = result == null ? new String[0] : result.split(":", -1);
        if (parts.length != 2) {
            throw new IllegalStateException("Unexpected rate window script result: " + result);
        }
        try {
            return new RateWindow(Integer.parseInt(parts[0]), nowMillis + Long.parseLong(parts[1]));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Unexpected rate window script result: " + result, e);
        }
    }
}
