package com.keacast.assistant.api.dto;

import java.util.List;

public record CompletionResponse(
        String content,
        List<ToolCall> toolCalls,
        String finishReason,
        boolean malformed
) {
    public CompletionResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    /** 上游返回里没有可用的 choice */
    public static CompletionResponse empty() {
        return new CompletionResponse("", List.of(), null, true);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
