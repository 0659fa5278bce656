package com.keacast.assistant.api.dto;

import java.util.List;

public record AssembledContext(
        List<ChatMessage> messages,   // 最终送模型的 messages
        int serializedBytes,
        int evictedCount,
        boolean contextTruncated,
        boolean withinBudget
) { }
