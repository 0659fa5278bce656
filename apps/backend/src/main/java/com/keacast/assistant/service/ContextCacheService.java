package com.keacast.assistant.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.keacast.assistant.api.dto.CachedContext;
import com.keacast.assistant.service.dto.CacheHealth;
import com.keacast.assistant.service.dto.CacheStats;
import com.keacast.assistant.util.CacheKeys;
import reactor.core.publisher.Mono;

import java.util.function.Predicate;
import java.util.function.Supplier;

public interface ContextCacheService {

    /**
     * Fresh cached context, or a rebuilt one. Never errors: when the cache and a direct build
     * both fail the result is {@link CachedContext#unavailable}.
     */
    Mono<CachedContext> get(String userId, String accountId, String token);

    /** 删除该用户全部 key，返回删除数量 */
    Mono<Long> invalidate(String userId);

    /** context / balances / transactions / marker of one account together */
    Mono<Long> invalidate(String userId, String accountId);

    Mono<Boolean> warmUp(String userId, String accountId, String token);

    Mono<CacheStats> stats(String userId);

    /**
     * Writes, reads back and deletes a short-lived key. Never errors: a failing store is reported
     * as {@link CacheHealth#UNHEALTHY}.
     */
    Mono<CacheHealth> health();

    /**
     * Read-through memoization in one tier. Store failures fall through to the loader.
     */
    default <T> Mono<T> cached(CacheTier tier, String key, TypeReference<T> type, Supplier<Mono<T>> loader) {
        return cached(tier, key, type, loader, value -> true);
    }

    /** @param cacheable 返回 false 的值只返回，不写入（例如降级结果） */
    <T> Mono<T> cached(CacheTier tier, String key, TypeReference<T> type, Supplier<Mono<T>> loader,
                       Predicate<T> cacheable);

    CacheKeys keys();
}
