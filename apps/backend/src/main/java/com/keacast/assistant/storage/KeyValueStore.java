package com.keacast.assistant.storage;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * String key/value store with per-key TTL. Session history and the context cache sit on top of it.
 * Patterns use glob syntax ({@code *}, {@code ?}); callers escape key segments before building them.
 */
public interface KeyValueStore {

    /** 不存在或已过期时为空 Mono */
    Mono<String> get(String key);

    Mono<Void> set(String key, String value, Duration ttl);

    /** 返回实际删除的 key 数 */
    Mono<Long> delete(Collection<String> keys);

    Mono<List<String>> keys(String pattern);

    /** 剩余 TTL；key 不存在时为空 Mono，没有过期时间时为 {@link Duration#ZERO} 以下的负值 */
    Mono<Duration> ttl(String key);
}
