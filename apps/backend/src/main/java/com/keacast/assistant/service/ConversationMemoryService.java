package com.keacast.assistant.service;

import com.keacast.assistant.api.dto.ChatMessage;
import com.keacast.assistant.service.dto.SessionHistory;
import reactor.core.publisher.Mono;

import java.util.List;

public interface ConversationMemoryService {

    /** Sanitized history, or an unavailable marker when the store could not be reached. */
    Mono<SessionHistory> read(String sessionKey);

    default Mono<List<ChatMessage>> load(String sessionKey) {
        return read(sessionKey).map(SessionHistory::messages);
    }

    /** 追加后裁剪到窗口大小并重置 TTL；存储失败只记日志 */
    Mono<Void> append(String sessionKey, List<ChatMessage> newMessages);

    Mono<Boolean> clear(String sessionKey);
}
