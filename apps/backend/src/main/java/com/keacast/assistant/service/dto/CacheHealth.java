package com.keacast.assistant.service.dto;

import java.time.Instant;

/**
 * Result of a write / read / delete round trip against the cache store.
 *
 * @param error 仅 unhealthy 时有值
 */
public record CacheHealth(
        String status,
        String storeType,
        boolean connected,
        boolean testPassed,
        long latencyMs,
        boolean cacheEnabled,
        Instant timestamp,
        String error
) {
    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    public static CacheHealth healthy(String storeType, long latencyMs, boolean cacheEnabled, Instant at) {
        return new CacheHealth(HEALTHY, storeType, true, true, latencyMs, cacheEnabled, at, null);
    }

    public static CacheHealth unhealthy(String storeType, boolean connected, long latencyMs, boolean cacheEnabled,
                                        Instant at, String error) {
        return new CacheHealth(UNHEALTHY, storeType, connected, false, latencyMs, cacheEnabled, at, error);
    }

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
