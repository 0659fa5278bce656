package com.keacast.assistant.util;

import com.keacast.assistant.api.dto.ChatMessage;
import com.keacast.assistant.api.dto.MessageRole;
import com.keacast.assistant.api.dto.ToolCall;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 去掉孤儿 tool 消息：tool 消息的 toolCallId 必须能在它之前的某条 assistant.toolCalls 里找到。
 * 结果再跑一遍不会变化。
 */
public final class HistorySanitizer {

    private HistorySanitizer() {}

    public static List<ChatMessage> sanitize(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        Set<String> announced = new HashSet<>();
        List<ChatMessage> out = new ArrayList<>(messages.size());
        for (ChatMessage m : messages) {
            if (m == null || m.role() == null) {
                continue;
            }
            if (m.role() == MessageRole.ASSISTANT) {
                for (ToolCall call : m.toolCalls()) {
                    if (call.id() != null) {
                        announced.add(call.id());
                    }
                }
            } else if (m.role() == MessageRole.TOOL) {
                if (m.toolCallId() == null || !announced.contains(m.toolCallId())) {
                    continue;
                }
            }
            out.add(m);
        }
        return out;
    }

    public static int orphanCount(List<ChatMessage> messages) {
        return (messages == null ? 0 : messages.size()) - sanitize(messages).size();
    }
}
