package com.keacast.assistant.api.dto;

import java.util.List;
import java.util.Map;

public record CompletionRequest(
        List<ChatMessage> messages,
        List<Map<String, Object>> tools,
        String toolChoice,     // "auto" | "none"
        Double temperature,
        Integer maxTokens
) {
    public static final String TOOL_CHOICE_AUTO = "auto";
    public static final String TOOL_CHOICE_NONE = "none";

    public CompletionRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : tools;
    }
}
