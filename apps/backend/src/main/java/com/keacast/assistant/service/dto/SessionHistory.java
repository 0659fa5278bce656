package com.keacast.assistant.service.dto;

import com.keacast.assistant.api.dto.ChatMessage;

import java.util.List;

/**
 * @param available false 表示会话存储不可用，messages 是降级后的空历史
 */
public record SessionHistory(List<ChatMessage> messages, boolean available) {

    public SessionHistory {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static SessionHistory of(List<ChatMessage> messages) {
        return new SessionHistory(messages, true);
    }

    public static SessionHistory unavailable() {
        return new SessionHistory(List.of(), false);
    }
}
