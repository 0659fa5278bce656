package com.keacast.assistant.api.dto;

import java.util.Map;

/**
 * Where the per-request context block comes from. Resolved once, before assembly.
 */
public record ContextSource(Kind kind, Map<String, Object> payload) {

    public enum Kind { NONE, EXPLICIT, CACHED }

    private static final ContextSource NONE_SOURCE = new ContextSource(Kind.NONE, Map.of());

    public ContextSource {
        payload = payload == null ? Map.of() : payload;
    }

    public static ContextSource none() {
        return NONE_SOURCE;
    }

    public static ContextSource explicit(Map<String, Object> payload) {
        return payload == null || payload.isEmpty() ? NONE_SOURCE : new ContextSource(Kind.EXPLICIT, payload);
    }

    public static ContextSource cached(CachedContext context) {
        if (context == null || context.payload().isEmpty()) {
            return NONE_SOURCE;
        }
        return new ContextSource(Kind.CACHED, context.payload());
    }

    public boolean isPresent() {
        return kind != Kind.NONE;
    }
}
