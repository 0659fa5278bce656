package com.keacast.assistant.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keacast.assistant.api.dto.CachedContext;
import com.keacast.assistant.config.AiProperties;
import com.keacast.assistant.config.CacheProperties;
import com.keacast.assistant.service.CacheTier;
import com.keacast.assistant.service.ContextCacheService;
import com.keacast.assistant.service.UserContextLoader;
import com.keacast.assistant.service.dto.CacheHealth;
import com.keacast.assistant.service.dto.CacheStats;
import com.keacast.assistant.storage.KeyValueStore;
import com.keacast.assistant.util.CacheKeys;
import com.keacast.assistant.util.ToolPayloads;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Tiered context cache on top of {@link KeyValueStore}.
 * <p>
 * Freshness is decided by the last-updated marker written next to the context payload, not by
 * the store TTL: a payload older than {@code ai.cache.freshness-minutes} is rebuilt even when the
 * store still holds it.
 */
@Slf4j
@Service
public class ContextCacheServiceImpl implements ContextCacheService {

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};
    private static final String HEALTH_VALUE = "ok";
    private static final Duration HEALTH_KEY_TTL = Duration.ofSeconds(10);

    private final KeyValueStore store;
    private final UserContextLoader loader;
    private final CacheProperties cacheProps;
    private final AiProperties aiProps;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final CacheKeys keys;

    public ContextCacheServiceImpl(KeyValueStore store,
                                   UserContextLoader loader,
                                   CacheProperties cacheProps,
                                   AiProperties aiProps,
                                   ObjectMapper mapper,
                                   Clock clock) {
        this.store = store;
        this.loader = loader;
        this.cacheProps = cacheProps;
        this.aiProps = aiProps;
        this.mapper = mapper;
        this.clock = clock;
        this.keys = new CacheKeys(cacheProps.getKeyPrefix());
    }

    private record Lookup(Optional<String> payload, Optional<String> marker, boolean storeDown) {
        static final Lookup STORE_DOWN = new Lookup(Optional.empty(), Optional.empty(), true);
    }

    @Override
    public Mono<CachedContext> get(String userId, String accountId, String token) {
        if (!cacheProps.isEnabled()) {
            return buildDirect(userId, accountId, token);
        }
        String ctxKey = keys.context(userId, accountId);
        String markerKey = keys.lastUpdated(userId, accountId);

        Mono<Optional<String>> payload = store.get(ctxKey).map(Optional::of).defaultIfEmpty(Optional.empty());
        Mono<Optional<String>> marker = store.get(markerKey).map(Optional::of).defaultIfEmpty(Optional.empty());

        return Mono.zip(payload, marker)
                .timeout(storeTimeout())
                .map(t -> new Lookup(t.getT1(), t.getT2(), false))
                .onErrorResume(e -> {
                    log.warn("[CTX-CACHE] store read failed user={} account={} err={}", userId, accountId, e.toString());
                    return Mono.just(Lookup.STORE_DOWN);
                })
                .flatMap(lookup -> {
                    if (lookup.storeDown()) {
                        return buildDirect(userId, accountId, token);
                    }
                    CachedContext hit = fromCache(userId, accountId, lookup);
                    if (hit != null) {
                        log.debug("[CTX-CACHE] hit user={} account={} age={}min", userId, accountId, hit.ageMinutes());
                        return Mono.just(hit);
                    }
                    return rebuild(userId, accountId, token)
                            .onErrorResume(e -> {
                                log.warn("[CTX-CACHE] rebuild failed user={} account={} err={}, trying direct build",
                                        userId, accountId, e.toString());
                                return buildDirect(userId, accountId, token);
                            });
                });
    }

    private CachedContext fromCache(String userId, String accountId, Lookup lookup) {
        if (lookup.payload().isEmpty() || lookup.marker().isEmpty()) {
            return null;
        }
        Instant builtAt;
        try {
            builtAt = Instant.parse(lookup.marker().get());
        } catch (DateTimeParseException e) {
            log.debug("[CTX-CACHE] unreadable marker '{}'", lookup.marker().get());
            return null;
        }
        Duration age = Duration.between(builtAt, clock.instant());
        if (age.isNegative()) {
            age = Duration.ZERO;
        }
        if (age.compareTo(Duration.ofMinutes(cacheProps.getFreshnessMinutes())) >= 0) {
            log.debug("[CTX-CACHE] stale user={} account={} age={}min", userId, accountId, age.toMinutes());
            return null;
        }
        Map<String, Object> payload = decode(lookup.payload().get(), MAP);
        if (payload == null) {
            return null;
        }
        return new CachedContext(userId, accountId, payload, builtAt, true, age.toMinutes(), false);
    }

    /** 重建并写回：子层（用户资料、余额）各自按 TTL 缓存 */
    private Mono<CachedContext> rebuild(String userId, String accountId, String token) {
        Instant builtAt = clock.instant();
        Mono<Map<String, Object>> userData = cached(CacheTier.USER_DATA, keys.userData(userId), MAP,
                () -> loader.loadUserData(userId, token));
        Mono<Map<String, Object>> balances = cached(CacheTier.BALANCES, keys.balances(userId, accountId), MAP,
                () -> loader.loadBalances(userId, accountId, token));

        return Mono.zip(userData, balances)
                .flatMap(t -> loader.buildContext(userId, accountId, token, t.getT1(), t.getT2()))
                .flatMap(payload -> writeContext(userId, accountId, payload, builtAt)
                        .thenReturn(CachedContext.fresh(userId, accountId, payload, builtAt)))
                .doOnNext(c -> log.info("[CTX-CACHE] rebuilt user={} account={} builtAt={}", userId, accountId, builtAt));
    }

    private Mono<Void> writeContext(String userId, String accountId, Map<String, Object> payload, Instant builtAt) {
        Duration ttl = CacheTier.USER_CONTEXT.ttl(cacheProps);
        // payload 先写，marker 后写
        return store.set(keys.context(userId, accountId), ToolPayloads.toJson(payload, mapper), ttl)
                .then(store.set(keys.lastUpdated(userId, accountId), builtAt.toString(), ttl))
                .timeout(storeTimeout())
                .onErrorResume(e -> {
                    log.warn("[CTX-CACHE] write failed user={} account={} err={}", userId, accountId, e.toString());
                    return Mono.empty();
                });
    }

    private Mono<CachedContext> buildDirect(String userId, String accountId, String token) {
        Instant builtAt = clock.instant();
        return Mono.zip(loader.loadUserData(userId, token), loader.loadBalances(userId, accountId, token))
                .flatMap(t -> loader.buildContext(userId, accountId, token, t.getT1(), t.getT2()))
                .map(payload -> CachedContext.fresh(userId, accountId, payload, builtAt))
                .doOnNext(c -> log.debug("[CTX-CACHE] direct build user={} account={}", userId, accountId))
                .onErrorResume(e -> {
                    log.error("[CTX-CACHE] direct build failed user={} account={} err={}", userId, accountId, e.toString());
                    return Mono.just(CachedContext.unavailable(userId, accountId));
                });
    }

    @Override
    public Mono<Long> invalidate(String userId) {
        return store.keys(keys.userPattern(userId))
                .flatMap(found -> found.isEmpty() ? Mono.just(0L) : store.delete(found))
                .timeout(storeTimeout())
                .doOnNext(n -> log.info("[CTX-CACHE] invalidated user={} keys={}", userId, n))
                .onErrorResume(e -> {
                    log.warn("[CTX-CACHE] invalidate user={} failed err={}", userId, e.toString());
                    return Mono.just(0L);
                });
    }

    @Override
    public Mono<Long> invalidate(String userId, String accountId) {
        List<String> fixed = List.of(
                keys.context(userId, accountId),
                keys.balances(userId, accountId),
                keys.lastUpdated(userId, accountId));
        return store.keys(keys.accountTransactionsPattern(userId, accountId))
                .flatMap(tx -> {
                    List<String> all = new ArrayList<>(fixed);
                    all.addAll(tx);
                    return store.delete(all);
                })
                .timeout(storeTimeout())
                .doOnNext(n -> log.info("[CTX-CACHE] invalidated user={} account={} keys={}", userId, accountId, n))
                .onErrorResume(e -> {
                    log.warn("[CTX-CACHE] invalidate user={} account={} failed err={}", userId, accountId, e.toString());
                    return Mono.just(0L);
                });
    }

    @Override
    public Mono<Boolean> warmUp(String userId, String accountId, String token) {
        if (!cacheProps.isEnabled()) {
            return Mono.just(false);
        }
        return rebuild(userId, accountId, token)
                .map(c -> true)
                .onErrorResume(e -> {
                    log.warn("[CTX-CACHE] warm-up failed user={} account={} err={}", userId, accountId, e.toString());
                    return Mono.just(false);
                });
    }

    @Override
    public Mono<CacheStats> stats(String userId) {
        return store.keys(keys.userPattern(userId))
                .flatMapMany(Flux::fromIterable)
                .concatMap(key -> Mono.zip(
                        store.ttl(key).map(d -> d.isNegative() ? -1L : d.getSeconds()).defaultIfEmpty(-1L),
                        store.get(key).map(v -> (long) ToolPayloads.utf8Length(v)).defaultIfEmpty(0L))
                        .map(t -> new CacheStats.KeyStat(key, t.getT1(), t.getT2(), CacheStats.kb(t.getT2()))))
                .collectList()
                .timeout(storeTimeout())
                .map(list -> {
                    long total = list.stream().mapToLong(CacheStats.KeyStat::size).sum();
                    return new CacheStats(userId, list.size(), list, total, CacheStats.kb(total), CacheStats.mb(total));
                });
    }

    @Override
    public Mono<CacheHealth> health() {
        String storeType = aiProps.getStore().getType();
        String key = keys.healthCheck(Long.toString(clock.millis()));
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return store.set(key, HEALTH_VALUE, HEALTH_KEY_TTL)
                    .then(store.get(key).defaultIfEmpty(""))
                    .flatMap(read -> store.delete(List.of(key)).thenReturn(read))
                    .timeout(storeTimeout())
                    .map(read -> {
                        long latency = Duration.ofNanos(System.nanoTime() - started).toMillis();
                        if (!HEALTH_VALUE.equals(read)) {
                            log.warn("[CTX-CACHE] health read-back mismatch key={} got='{}'", key, read);
                            return CacheHealth.unhealthy(storeType, true, latency, cacheProps.isEnabled(),
                                    clock.instant(), "read-back mismatch");
                        }
                        return CacheHealth.healthy(storeType, latency, cacheProps.isEnabled(), clock.instant());
                    })
                    .onErrorResume(e -> {
                        log.warn("[CTX-CACHE] health check failed store={} err={}", storeType, e.toString());
                        long latency = Duration.ofNanos(System.nanoTime() - started).toMillis();
                        return Mono.just(CacheHealth.unhealthy(storeType, false, latency, cacheProps.isEnabled(),
                                clock.instant(), e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
                    });
        });
    }

    @Override
    public <T> Mono<T> cached(CacheTier tier, String key, TypeReference<T> type, Supplier<Mono<T>> source,
                              Predicate<T> cacheable) {
        if (!cacheProps.isEnabled()) {
            return source.get();
        }
        return store.get(key)
                .timeout(storeTimeout())
                .map(json -> Optional.ofNullable(decode(json, type)))
                .defaultIfEmpty(Optional.<T>empty())
                .onErrorResume(e -> {
                    log.warn("[CTX-CACHE] tier={} read failed key={} err={}", tier, key, e.toString());
                    return Mono.just(Optional.<T>empty());
                })
                .flatMap(hit -> {
                    if (hit.isPresent()) {
                        log.debug("[CTX-CACHE] tier={} hit key={}", tier, key);
                        return Mono.just(hit.get());
                    }
                    return source.get().flatMap(value -> {
                        if (!cacheable.test(value)) {
                            return Mono.just(value);
                        }
                        return store.set(key, ToolPayloads.toJson(value, mapper), tier.ttl(cacheProps))
                                .timeout(storeTimeout())
                                .onErrorResume(e -> {
                                    log.warn("[CTX-CACHE] tier={} write failed key={} err={}", tier, key, e.toString());
                                    return Mono.empty();
                                })
                                .thenReturn(value);
                    });
                });
    }

    @Override
    public CacheKeys keys() {
        return keys;
    }

    private Duration storeTimeout() {
        return Duration.ofMillis(aiProps.getStore().getTimeoutMs());
    }

    private <T> T decode(String json, TypeReference<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            log.debug("[CTX-CACHE] drop unreadable entry: {}", e.getMessage());
            return null;
        }
    }
}
