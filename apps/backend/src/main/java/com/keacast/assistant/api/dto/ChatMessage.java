package com.keacast.assistant.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One turn of a conversation. {@code toolCalls} is only set on assistant turns,
 * {@code toolCallId} only on tool turns.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ChatMessage(
        MessageRole role,
        String content,
        List<ToolCall> toolCalls,
        String toolCallId
) {
    public ChatMessage {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content, null, null);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content, null, null);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, null);
    }

    public static ChatMessage assistantToolCalls(String content, List<ToolCall> calls) {
        return new ChatMessage(MessageRole.ASSISTANT, content, calls, null);
    }

    public static ChatMessage tool(String toolCallId, String content) {
        return new ChatMessage(MessageRole.TOOL, content, null, toolCallId);
    }

    public ChatMessage withContent(String newContent) {
        return new ChatMessage(role, newContent, toolCalls, toolCallId);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
