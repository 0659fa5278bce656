package com.keacast.assistant.storage.impl;

import com.keacast.assistant.storage.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Redis 实现。StringRedisTemplate 是阻塞调用，统一丢到 boundedElastic。
 * keys 用 SCAN 而不是 KEYS，避免阻塞 Redis。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ai.store.type", havingValue = "redis")
public class RedisKeyValueStore implements KeyValueStore {

    private static final long SCAN_BATCH = 500;

    private final StringRedisTemplate redis;

    @Override
    public Mono<String> get(String key) {
        return Mono.fromCallable(() -> redis.opsForValue().get(key))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        return Mono.fromRunnable(() -> {
                    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                        redis.opsForValue().set(key, value);
                    } else {
                        redis.opsForValue().set(key, value, ttl);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<Long> delete(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return Mono.just(0L);
        }
        return Mono.fromCallable(() -> {
                    Long n = redis.delete(keys);
                    return n == null ? 0L : n;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<List<String>> keys(String pattern) {
        return Mono.fromCallable(() -> {
                    List<String> out = new ArrayList<>();
                    ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
                    try (Cursor<String> cursor = redis.scan(options)) {
                        cursor.forEachRemaining(out::add);
                    }
                    log.debug("[KV] scan pattern={} hits={}", pattern, out.size());
                    return out;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Duration> ttl(String key) {
        return Mono.fromCallable(() -> {
                    Long seconds = redis.getExpire(key, TimeUnit.SECONDS);
                    // -2: key 不存在
                    if (seconds == null || seconds == -2L) {
                        return null;
                    }
                    return Duration.ofSeconds(seconds);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
