package com.keacast.assistant.storage.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKeyValueStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore(1_000, nanos::get);
    }

    private void advance(Duration d) {
        nanos.addAndGet(d.toNanos());
    }

    @Test
    void entries_expire_after_their_own_ttl() {
        store.set("short", "1", Duration.ofMinutes(1)).block();
        store.set("long", "2", Duration.ofHours(1)).block();

        advance(Duration.ofMinutes(2));

        StepVerifier.create(store.get("short")).verifyComplete();
        StepVerifier.create(store.get("long")).expectNext("2").verifyComplete();
    }

    @Test
    void overwrite_resets_ttl() {
        store.set("k", "v1", Duration.ofMinutes(10)).block();
        advance(Duration.ofMinutes(8));
        store.set("k", "v2", Duration.ofMinutes(10)).block();
        advance(Duration.ofMinutes(8));

        StepVerifier.create(store.get("k")).expectNext("v2").verifyComplete();
    }

    @Test
    void ttl_reports_remaining_time_missing_and_no_expiry() {
        store.set("k", "v", Duration.ofSeconds(100)).block();
        store.set("forever", "v", null).block();
        advance(Duration.ofSeconds(40));

        Duration left = store.ttl("k").block();
        assertNotNull(left);
        assertEquals(60, left.toSeconds());
        assertTrue(store.ttl("forever").block().isNegative());
        StepVerifier.create(store.ttl("absent")).verifyComplete();
    }

    @Test
    void keys_match_glob_and_delete_counts_only_existing() {
        store.set("ctx:u1:context:a1", "x", Duration.ofMinutes(5)).block();
        store.set("ctx:u1:balances:a1", "x", Duration.ofMinutes(5)).block();
        store.set("ctx:u10:context:a1", "x", Duration.ofMinutes(5)).block();

        List<String> found = store.keys("ctx:u1:*").block();
        assertEquals(List.of("ctx:u1:balances:a1", "ctx:u1:context:a1"), found);

        assertEquals(2L, store.delete(List.of("ctx:u1:context:a1", "ctx:u1:balances:a1", "nope")).block());
        assertEquals(List.of("ctx:u10:context:a1"), store.keys("ctx:*").block());
    }

    @Test
    void regex_metacharacters_in_keys_are_literal() {
        store.set("a.b", "x", Duration.ofMinutes(1)).block();
        store.set("aXb", "x", Duration.ofMinutes(1)).block();

        assertEquals(List.of("a.b"), store.keys("a.b").block());
        assertEquals(List.of("a.b", "aXb"), store.keys("a?b").block());
    }
}
