package com.keacast.assistant.storage.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.keacast.assistant.config.AiProperties;
import com.keacast.assistant.storage.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 单机 Caffeine 实现，每个 key 按写入时给的 TTL 过期（variable expiry）。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "ai.store.type", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryKeyValueStore implements KeyValueStore {

    private record Entry(String value, long ttlNanos) { }

    private static final long NO_EXPIRY = Long.MAX_VALUE;

    private final Cache<String, Entry> cache;

    @Autowired
    public InMemoryKeyValueStore(AiProperties props) {
        this(props.getStore().getMaxEntries(), Ticker.systemTicker());
    }

    public InMemoryKeyValueStore(long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .ticker(ticker)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry e, long currentTime) {
                        return e.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry e, long currentTime, long currentDuration) {
                        return e.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry e, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
        log.info("[KV] in-memory store ready maxEntries={}", maxEntries);
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> {
            Entry e = cache.getIfPresent(key);
            return e == null ? null : e.value();
        });
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        return Mono.fromRunnable(() -> {
            long nanos = ttl == null || ttl.isZero() || ttl.isNegative() ? NO_EXPIRY : ttl.toNanos();
            cache.put(key, new Entry(value, nanos));
        });
    }

    @Override
    public Mono<Long> delete(Collection<String> keys) {
        return Mono.fromSupplier(() -> {
            long removed = 0;
            for (String k : keys) {
                if (cache.getIfPresent(k) != null) {
                    cache.invalidate(k);
                    removed++;
                }
            }
            return removed;
        });
    }

    @Override
    public Mono<List<String>> keys(String pattern) {
        return Mono.fromSupplier(() -> {
            Pattern regex = globToRegex(pattern);
            return cache.asMap().keySet().stream()
                    .filter(k -> regex.matcher(k).matches())
                    .sorted()
                    .toList();
        });
    }

    @Override
    public Mono<Duration> ttl(String key) {
        return Mono.fromSupplier(() -> {
            Entry e = cache.getIfPresent(key);
            if (e == null) {
                return null;
            }
            if (e.ttlNanos() == NO_EXPIRY) {
                return Duration.ofSeconds(-1);
            }
            Optional<Duration> left = cache.policy().expireVariably()
                    .flatMap(p -> p.getExpiresAfter(key));
            return left.orElse(Duration.ofSeconds(-1));
        });
    }

    static Pattern globToRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }
}
