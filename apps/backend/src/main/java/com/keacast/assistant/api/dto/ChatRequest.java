package com.keacast.assistant.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record ChatRequest(
        @NotBlank String sessionId,
        String userId,
        String accountId,
        String token,
        @NotBlank String message,
        String systemPrompt,
        Map<String, Object> context,   // caller-supplied context; wins over the cache
        Boolean useCache
) { }
