package com.keacast.assistant.api.dto;

import java.time.Instant;
import java.util.Map;

public record CachedContext(
        String userId,
        String accountId,
        Map<String, Object> payload,
        Instant builtAt,
        boolean cached,       // served from the cache without a rebuild
        long ageMinutes,
        boolean degraded      // cache and direct build both failed; payload is empty
) {
    public CachedContext {
        payload = payload == null ? Map.of() : payload;
    }

    public static CachedContext fresh(String userId, String accountId, Map<String, Object> payload, Instant builtAt) {
        return new CachedContext(userId, accountId, payload, builtAt, false, 0, false);
    }

    public static CachedContext unavailable(String userId, String accountId) {
        return new CachedContext(userId, accountId, Map.of(), null, false, 0, true);
    }
}
