package com.keacast.assistant.api.dto;

/**
 * 模型请求的一次工具调用；arguments 保持模型给出的原始 JSON 字符串。
 */
public record ToolCall(
        String id,
        String name,
        String argumentsJson
) {
    public static ToolCall of(String id, String name, String argumentsJson) {
        return new ToolCall(id, name, argumentsJson == null || argumentsJson.isBlank() ? "{}" : argumentsJson);
    }
}
