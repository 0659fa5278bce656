package com.keacast.assistant.api.dto;

import java.util.Map;

public record ToolResult(
        String callId,
        String name,
        String status,        // "SUCCESS" | "ERROR"
        Object data,          // payload (possibly truncated) or error body
        String errorMessage,
        int serializedSize,   // size of the payload before truncation
        boolean truncated
) {
    public static final String SUCCESS = "SUCCESS";
    public static final String ERROR = "ERROR";

    public static ToolResult success(String callId, String name, Object data) {
        return new ToolResult(callId, name, SUCCESS, data, null, 0, false);
    }

    public static ToolResult error(String callId, String name, String error) {
        String msg = error == null || error.isBlank() ? "unknown error" : error;
        return new ToolResult(callId, name, ERROR, Map.of("message", msg), msg, 0, false);
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public ToolResult withCallId(String id) {
        return new ToolResult(id, name, status, data, errorMessage, serializedSize, truncated);
    }

    public ToolResult bounded(Object boundedData, int originalSize, boolean wasTruncated) {
        return new ToolResult(callId, name, status, boundedData, errorMessage, originalSize, wasTruncated);
    }
}
