package com.example.shield.store;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Redis hash holding runtime toggle overrides.
 */
@Service
@RequiredArgsConstructor
public class RuntimeConfigStore {

    private final ReactiveStringRedisTemplate redisTemplate;

    private ReactiveHashOperations<String, String, String> hashOps() {
        return redisTemplate.opsForHash();
    }

    public Mono<Map<String, String>> loadAll() {
        return hashOps()
                .entries(RedisKeys.RUNTIME_CONFIG_HASH)
                .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    public Mono<Boolean> put(String key, String value) {
        return hashOps().put(RedisKeys.RUNTIME_CONFIG_HASH, key, value);
    }
}
