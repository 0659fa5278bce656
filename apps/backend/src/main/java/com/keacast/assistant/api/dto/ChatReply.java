package com.keacast.assistant.api.dto;

import java.util.List;

public record ChatReply(
        String response,
        String sessionId,
        int memoryUsed,
        List<String> toolSummaries,
        boolean degraded,
        List<String> degradations
) { }
