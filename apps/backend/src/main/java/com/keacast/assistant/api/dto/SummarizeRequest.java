package com.keacast.assistant.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.Map;

public record SummarizeRequest(
        @NotBlank String sessionId,
        String userId,
        List<Map<String, Object>> transactions
) { }
