package com.keacast.assistant.storage.impl;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RedisKeyValueStoreTest {

    @Test
    @SuppressWarnings("unchecked")
    void set_uses_ttl_and_get_reads_value() {
        var redis = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.get("k")).thenReturn("v");
        RedisKeyValueStore store = new RedisKeyValueStore(redis);

        store.set("k", "v", Duration.ofMinutes(5)).block();
        store.set("forever", "v", null).block();

        verify(ops).set("k", "v", Duration.ofMinutes(5));
        verify(ops).set("forever", "v");
        StepVerifier.create(store.get("k")).expectNext("v").verifyComplete();
    }

    @Test
    void ttl_maps_redis_sentinels() {
        var redis = mock(StringRedisTemplate.class);
        when(redis.getExpire("absent", TimeUnit.SECONDS)).thenReturn(-2L);
        when(redis.getExpire("forever", TimeUnit.SECONDS)).thenReturn(-1L);
        when(redis.getExpire("k", TimeUnit.SECONDS)).thenReturn(42L);
        RedisKeyValueStore store = new RedisKeyValueStore(redis);

        StepVerifier.create(store.ttl("absent")).verifyComplete();
        assertTrue(store.ttl("forever").block().isNegative());
        assertEquals(Duration.ofSeconds(42), store.ttl("k").block());
    }

    @Test
    @SuppressWarnings("unchecked")
    void keys_are_collected_with_scan_and_deleted_in_one_call() {
        var redis = mock(StringRedisTemplate.class);
        Cursor<String> cursor = mock(Cursor.class);
        Iterator<String> it = List.of("ctx:u1:context:a1", "ctx:u1:userdata").iterator();
        doAnswer(inv -> {
            it.forEachRemaining(inv.<Consumer<String>>getArgument(0));
            return null;
        }).when(cursor).forEachRemaining(any());
        when(redis.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(redis.delete(anyCollection())).thenReturn(2L);
        RedisKeyValueStore store = new RedisKeyValueStore(redis);

        List<String> keys = store.keys("ctx:u1:*").block();

        assertEquals(List.of("ctx:u1:context:a1", "ctx:u1:userdata"), keys);
        assertEquals(2L, store.delete(keys).block());
        assertEquals(0L, store.delete(List.of()).block());
        verify(cursor).close();
    }
}
