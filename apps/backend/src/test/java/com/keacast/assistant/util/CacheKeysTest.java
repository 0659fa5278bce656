package com.keacast.assistant.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    private final CacheKeys keys = new CacheKeys("ctx");

    @Test
    void layoutPerPurpose() {
        assertThat(keys.context("u1", "a1")).isEqualTo("ctx:u1:context:a1");
        assertThat(keys.userData("u1")).isEqualTo("ctx:u1:userdata");
        assertThat(keys.balances("u1", "a1")).isEqualTo("ctx:u1:balances:a1");
        assertThat(keys.lastUpdated("u1", "a1")).isEqualTo("ctx:u1:lastupdated:a1");
        assertThat(keys.transactions("u1", "a1", "2024-01-01_2024-12-31"))
                .isEqualTo("ctx:u1:transactions:a1:2024-01-01_2024-12-31");
        assertThat(keys.userPattern("u1")).isEqualTo("ctx:u1:*");
    }

    @Test
    void separatorsInIdsCannotCollide() {
        // user "u:context" + account "a" vs user "u" + account "context:a"
        assertThat(keys.context("u:context", "a")).isNotEqualTo(keys.balances("u", "context:a"));
        assertThat(keys.context("u:1", "a")).isEqualTo("ctx:u%3A1:context:a");
    }

    @Test
    void globCharactersAreEscapedInPatterns() {
        assertThat(keys.userPattern("*")).isEqualTo("ctx:%2A:*");
        assertThat(CacheKeys.escape("a?b[c]%d\\")).isEqualTo("a%3Fb%5Bc%5D%25d%5C");
    }

    @Test
    void missingSegmentDoesNotCollideWithLiteralIds() {
        assertThat(keys.context("u", null)).isNotEqualTo(keys.context("u", "_"));
        assertThat(keys.context("u", null)).isNotEqualTo(keys.context("u", "%00"));
        assertThat(keys.context("u", null)).isEqualTo("ctx:u:context:%00");
        assertThat(CacheKeys.escape("%00")).isEqualTo("%2500");
    }
}
